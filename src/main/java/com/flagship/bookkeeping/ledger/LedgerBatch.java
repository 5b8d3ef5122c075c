package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class LedgerBatch {
    String referenceNumber;
    Money debitTotal;
    Money creditTotal;
    String createdBy;
    Instant createdAt;
    List<LedgerEntry> lines;

    public boolean isFullyPending() {
        return lines.stream().noneMatch(LedgerEntry::isPosted);
    }
}
