package com.flagship.bookkeeping.account;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Input for creating a General or Detail account. {@code generalAccountNumber}
 * is required for Detail accounts and ignored for General ones. Report type and
 * normal side fall back to the category defaults.
 */
@Value
public class NewAccountRequest {

    @NotBlank(message = "Account number is required")
    @Size(max = 50, message = "Account number must be at most 50 characters")
    @JsonProperty("account_number")
    String accountNumber;

    @NotBlank(message = "Account name is required")
    @Size(max = 200, message = "Account name must be at most 200 characters")
    @JsonProperty("account_name")
    String accountName;

    @NotNull(message = "Account category is required")
    @JsonProperty("category")
    AccountCategory category;

    @JsonProperty("report_type")
    ReportType reportType;

    @JsonProperty("normal_side")
    NormalSide normalSide;

    @JsonProperty("general_account_number")
    String generalAccountNumber;

    @DecimalMin(value = "0.00", message = "Initial credit must not be negative")
    @JsonProperty("initial_amount_credit")
    BigDecimal initialAmountCredit;

    @DecimalMin(value = "0.00", message = "Initial debit must not be negative")
    @JsonProperty("initial_amount_debit")
    BigDecimal initialAmountDebit;

    public ReportType effectiveReportType() {
        return reportType != null ? reportType : category.getDefaultReportType();
    }

    public NormalSide effectiveNormalSide() {
        return normalSide != null ? normalSide : category.getDefaultNormalSide();
    }
}
