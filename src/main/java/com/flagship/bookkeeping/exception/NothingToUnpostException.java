package com.flagship.bookkeeping.exception;

import java.time.LocalDate;
import java.util.Map;

public class NothingToUnpostException extends BookkeepingException {

    public NothingToUnpostException(LocalDate date, String what) {
        super(ErrorCategory.NOT_FOUND, "NOTHING_TO_UNPOST",
                "No posted " + what + " found for " + date,
                Map.of("date", date.toString()));
    }
}
