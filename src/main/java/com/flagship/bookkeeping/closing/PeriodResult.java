package com.flagship.bookkeeping.closing;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PeriodResult {
    UUID id;
    int periodYear;
    Money amount;
    Money totalRevenue;
    Money totalExpense;
    String equityAccountNumber;
    String generalAccountNumber;
    boolean closed;
    Instant closedAt;
    String closedBy;
    Instant createdAt;
    Instant updatedAt;
}
