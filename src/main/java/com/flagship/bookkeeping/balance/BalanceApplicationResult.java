package com.flagship.bookkeeping.balance;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BalanceApplicationResult {
    LocalDate date;
    int journalEntries;
    List<AccountBalanceChange> accounts;
    Instant processedAt;
}
