package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Half-open interval [start of day, start of next day) for a ledger date.
 */
@Value
public class DayBounds {
    LocalDate date;
    LocalDateTime startInclusive;
    LocalDateTime endExclusive;

    public static DayBounds of(LocalDate date) {
        return new DayBounds(date, date.atStartOfDay(), date.plusDays(1).atStartOfDay());
    }
}
