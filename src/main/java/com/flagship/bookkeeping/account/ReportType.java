package com.flagship.bookkeeping.account;

public enum ReportType {
    BALANCE_SHEET,
    INCOME_STATEMENT
}
