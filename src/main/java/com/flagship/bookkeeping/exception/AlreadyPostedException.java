package com.flagship.bookkeeping.exception;

import java.time.LocalDate;
import java.util.Map;

public class AlreadyPostedException extends BookkeepingException {

    public AlreadyPostedException(LocalDate date, String reason) {
        super(ErrorCategory.STATE_CONFLICT, "ALREADY_POSTED",
                "Ledger for " + date + " cannot be posted: " + reason,
                Map.of("date", date.toString(), "reason", reason));
    }
}
