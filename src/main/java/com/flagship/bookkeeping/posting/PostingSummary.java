package com.flagship.bookkeeping.posting;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PostingSummary {
    LocalDate date;
    int postedCount;
    int groupCount;
    Money debitTotal;
    Money creditTotal;
    Instant postedAt;
}
