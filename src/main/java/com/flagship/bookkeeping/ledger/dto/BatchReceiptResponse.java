package com.flagship.bookkeeping.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.BatchReceipt;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class BatchReceiptResponse {

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("line_count")
    int lineCount;

    @JsonProperty("debit_total")
    BigDecimal debitTotal;

    @JsonProperty("credit_total")
    BigDecimal creditTotal;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BatchReceiptResponse from(BatchReceipt receipt) {
        return new BatchReceiptResponse(
            receipt.getReferenceNumber(),
            receipt.getLineCount(),
            receipt.getDebitTotal().toBigDecimal(),
            receipt.getCreditTotal().toBigDecimal(),
            receipt.getCreatedAt()
        );
    }
}
