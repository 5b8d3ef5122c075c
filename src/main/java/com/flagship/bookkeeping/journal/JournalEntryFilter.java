package com.flagship.bookkeeping.journal;

import com.flagship.bookkeeping.ledger.PostingStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional criteria for listing journal entries. A null field does not filter.
 */
@Value
@Builder
public class JournalEntryFilter {
    LocalDate fromDate;
    LocalDate toDate;
    PostingStatus postingStatus;
    String detailAccountNumber;
    String generalAccountNumber;
}
