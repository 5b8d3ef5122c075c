package com.flagship.bookkeeping.closing;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Preview of a period close: the figures that would be saved, the row already
 * saved for the year if any, and whether saving is still allowed.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PeriodResultCalculation {
    int year;
    NetResult result;
    PeriodResult existing;
    boolean canSave;
}
