package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.ledger.PostingStatus;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Per (Detail account, day) totals produced by a posting run.
 */
@Value
public class JournalEntry {
    UUID id;
    String detailAccountNumber;
    String generalAccountNumber;
    LocalDate ledgerDate;
    Money amountDebit;
    Money amountCredit;
    int lineCount;
    PostingStatus postingStatus;
    Instant postedAt;
    Instant postingRunAt;
}
