package com.flagship.bookkeeping.posting;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UnpostingSummary {
    LocalDate date;
    int unpostedCount;
    int deletedGroups;
    Instant unpostedAt;
}
