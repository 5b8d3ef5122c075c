package com.flagship.bookkeeping.ledger;

/**
 * Lifecycle of ledger lines and journal entries. Lines go PENDING to POSTED on
 * posting and back on unposting; journal entries do the same on balance
 * application and reversal.
 */
public enum PostingStatus {
    PENDING,
    POSTED
}
