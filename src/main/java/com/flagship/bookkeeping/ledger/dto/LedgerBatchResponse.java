package com.flagship.bookkeeping.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerBatch;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.ledger.PostingStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
public class LedgerBatchResponse {

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("debit_total")
    BigDecimal debitTotal;

    @JsonProperty("credit_total")
    BigDecimal creditTotal;

    @JsonProperty("fully_pending")
    boolean fullyPending;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("lines")
    List<Line> lines;

    @Value
    public static class Line {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("detail_account_number")
        String detailAccountNumber;

        @JsonProperty("general_account_number")
        String generalAccountNumber;

        @JsonProperty("entry_type")
        EntryType entryType;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("description")
        String description;

        @JsonProperty("ledger_date")
        LocalDateTime ledgerDate;

        @JsonProperty("posting_status")
        PostingStatus postingStatus;

        @JsonProperty("posted_at")
        Instant postedAt;

        static Line from(LedgerEntry entry) {
            return new Line(
                entry.getId(),
                entry.getLineNumber(),
                entry.getDetailAccountNumber(),
                entry.getGeneralAccountNumber(),
                entry.getEntryType(),
                entry.getAmount().toBigDecimal(),
                entry.getDescription(),
                entry.getLedgerDate(),
                entry.getPostingStatus(),
                entry.getPostedAt()
            );
        }
    }

    public static LedgerBatchResponse from(LedgerBatch batch) {
        return new LedgerBatchResponse(
            batch.getReferenceNumber(),
            batch.getDebitTotal().toBigDecimal(),
            batch.getCreditTotal().toBigDecimal(),
            batch.isFullyPending(),
            batch.getCreatedBy(),
            batch.getCreatedAt(),
            batch.getLines().stream().map(Line::from).collect(Collectors.toList())
        );
    }
}
