package com.flagship.bookkeeping.exception;

import java.util.Map;

public class PeriodClosedException extends BookkeepingException {

    private final int year;

    public PeriodClosedException(int year) {
        super(ErrorCategory.STATE_CONFLICT, "PERIOD_CLOSED",
                "Period " + year + " is closed",
                Map.of("year", year));
        this.year = year;
    }

    public int getYear() {
        return year;
    }
}
