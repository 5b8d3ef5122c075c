package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A stored ledger line with both account references resolved to numbers.
 */
@Value
@Builder
public class LedgerEntry {
    UUID id;
    String referenceNumber;
    int lineNumber;
    Money amount;
    String description;
    UUID detailAccountId;
    String detailAccountNumber;
    UUID generalAccountId;
    String generalAccountNumber;
    EntryType entryType;
    LocalDateTime ledgerDate;
    PostingStatus postingStatus;
    Instant postedAt;
    String createdBy;
    String updatedBy;
    Instant createdAt;
    Instant updatedAt;

    public boolean isPosted() {
        return postingStatus == PostingStatus.POSTED;
    }
}
