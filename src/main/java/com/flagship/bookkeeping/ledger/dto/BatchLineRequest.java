package com.flagship.bookkeeping.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.BatchLine;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
public class BatchLineRequest {

    @NotBlank(message = "Detail account number is required")
    @JsonProperty("detail_account_number")
    String detailAccountNumber;

    @NotBlank(message = "General account number is required")
    @JsonProperty("general_account_number")
    String generalAccountNumber;

    @NotNull(message = "Entry type is required")
    @JsonProperty("entry_type")
    EntryType entryType;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500)
    @JsonProperty("description")
    String description;

    @NotNull(message = "Ledger date is required")
    @JsonProperty("ledger_date")
    LocalDateTime ledgerDate;

    public BatchLine toBatchLine() {
        return BatchLine.of(detailAccountNumber, generalAccountNumber, entryType,
                Money.of(amount), description, ledgerDate);
    }
}
