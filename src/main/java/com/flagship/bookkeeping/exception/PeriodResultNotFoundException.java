package com.flagship.bookkeeping.exception;

import java.util.Map;

public class PeriodResultNotFoundException extends BookkeepingException {

    public PeriodResultNotFoundException(int year) {
        super(ErrorCategory.NOT_FOUND, "PERIOD_RESULT_NOT_FOUND",
                "No period result saved for " + year,
                Map.of("year", year));
    }
}
