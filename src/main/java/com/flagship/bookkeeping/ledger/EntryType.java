package com.flagship.bookkeeping.ledger;

public enum EntryType {
    DEBIT,
    CREDIT
}
