package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;

@Value
public class BatchReceipt {
    String referenceNumber;
    int lineCount;
    Money debitTotal;
    Money creditTotal;
    Instant createdAt;
}
