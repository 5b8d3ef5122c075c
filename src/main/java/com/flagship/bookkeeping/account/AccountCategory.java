package com.flagship.bookkeeping.account;

/**
 * Account classification with the report grouping and normal side each
 * category takes unless the account says otherwise.
 */
public enum AccountCategory {
    ASSET(ReportType.BALANCE_SHEET, NormalSide.DEBIT),
    LIABILITY(ReportType.BALANCE_SHEET, NormalSide.CREDIT),
    EQUITY(ReportType.BALANCE_SHEET, NormalSide.CREDIT),
    REVENUE(ReportType.INCOME_STATEMENT, NormalSide.CREDIT),
    EXPENSE(ReportType.INCOME_STATEMENT, NormalSide.DEBIT);

    private final ReportType defaultReportType;
    private final NormalSide defaultNormalSide;

    AccountCategory(ReportType defaultReportType, NormalSide defaultNormalSide) {
        this.defaultReportType = defaultReportType;
        this.defaultNormalSide = defaultNormalSide;
    }

    public ReportType getDefaultReportType() {
        return defaultReportType;
    }

    public NormalSide getDefaultNormalSide() {
        return defaultNormalSide;
    }
}
