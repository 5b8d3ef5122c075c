package com.flagship.bookkeeping.closing;

public enum PeriodResultOperation {
    CREATED,
    UPDATED
}
