package com.flagship.bookkeeping.account;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("category")
    AccountCategory category;

    @JsonProperty("report_type")
    ReportType reportType;

    @JsonProperty("normal_side")
    NormalSide normalSide;

    @JsonProperty("general_account_number")
    String generalAccountNumber;

    @JsonProperty("amount_debit")
    BigDecimal amountDebit;

    @JsonProperty("amount_credit")
    BigDecimal amountCredit;

    @JsonProperty("accumulation_amount_debit")
    BigDecimal accumulationAmountDebit;

    @JsonProperty("accumulation_amount_credit")
    BigDecimal accumulationAmountCredit;

    @JsonProperty("deleted")
    boolean deleted;

    @JsonProperty("deleted_at")
    Instant deletedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .kind(account.getKind())
            .accountNumber(account.getNumber())
            .accountName(account.getAccountName())
            .category(account.getCategory())
            .reportType(account.getReportType())
            .normalSide(account.getNormalSide())
            .generalAccountNumber(account.getGeneralAccountNumber())
            .amountDebit(account.getAmountDebit().toBigDecimal())
            .amountCredit(account.getAmountCredit().toBigDecimal())
            .accumulationAmountDebit(account.getAccumulationAmountDebit().toBigDecimal())
            .accumulationAmountCredit(account.getAccumulationAmountCredit().toBigDecimal())
            .deleted(!account.isActive())
            .deletedAt(account.getDeletedAt())
            .build();
    }
}
