package com.flagship.bookkeeping.closing;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PeriodCloseResult {
    int year;
    Money netResult;
    PeriodResultOperation operation;
    String equityAccountNumber;
    Money accumulationCredit;
    Money accumulationDebit;
    Instant savedAt;
}
