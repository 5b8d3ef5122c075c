package com.flagship.bookkeeping.journal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.PostingStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("detail_account_number")
    String detailAccountNumber;

    @JsonProperty("general_account_number")
    String generalAccountNumber;

    @JsonProperty("ledger_date")
    LocalDate ledgerDate;

    @JsonProperty("amount_debit")
    BigDecimal amountDebit;

    @JsonProperty("amount_credit")
    BigDecimal amountCredit;

    @JsonProperty("line_count")
    int lineCount;

    @JsonProperty("posting_status")
    PostingStatus postingStatus;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("posting_run_at")
    Instant postingRunAt;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .detailAccountNumber(entry.getDetailAccountNumber())
            .generalAccountNumber(entry.getGeneralAccountNumber())
            .ledgerDate(entry.getLedgerDate())
            .amountDebit(entry.getAmountDebit().toBigDecimal())
            .amountCredit(entry.getAmountCredit().toBigDecimal())
            .lineCount(entry.getLineCount())
            .postingStatus(entry.getPostingStatus())
            .postedAt(entry.getPostedAt())
            .postingRunAt(entry.getPostingRunAt())
            .build();
    }
}
