package com.flagship.bookkeeping.exception;

import java.time.LocalDate;
import java.util.Map;

/**
 * Ledger lines of a day cannot go back to PENDING while that day's journal
 * entries still have their balances applied.
 */
public class CannotUnpostException extends BookkeepingException {

    public CannotUnpostException(LocalDate date, long postedJournalCount) {
        super(ErrorCategory.STATE_CONFLICT, "CANNOT_UNPOST",
                String.format("Ledger for %s cannot be unposted: %d journal entr%s already applied to balances",
                        date, postedJournalCount, postedJournalCount == 1 ? "y is" : "ies are"),
                Map.of("date", date.toString(), "postedJournalEntries", postedJournalCount));
    }
}
