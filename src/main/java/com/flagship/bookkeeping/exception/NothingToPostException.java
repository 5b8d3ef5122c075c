package com.flagship.bookkeeping.exception;

import java.time.LocalDate;
import java.util.Map;

public class NothingToPostException extends BookkeepingException {

    public NothingToPostException(LocalDate date, String what) {
        super(ErrorCategory.NOT_FOUND, "NOTHING_TO_POST",
                "No pending " + what + " found for " + date,
                Map.of("date", date.toString()));
    }
}
