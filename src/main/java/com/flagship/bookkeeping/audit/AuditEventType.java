package com.flagship.bookkeeping.audit;

public enum AuditEventType {
    BATCH_SUBMITTED("LedgerBatchSubmitted", AuditAggregate.LEDGER_BATCH),
    BATCH_DELETED("LedgerBatchDeleted", AuditAggregate.LEDGER_BATCH),
    LEDGER_POSTED("LedgerPosted", AuditAggregate.LEDGER_DAY),
    LEDGER_UNPOSTED("LedgerUnposted", AuditAggregate.LEDGER_DAY),
    BALANCES_APPLIED("BalancesApplied", AuditAggregate.LEDGER_DAY),
    BALANCES_REVERTED("BalancesReverted", AuditAggregate.LEDGER_DAY),
    PERIOD_RESULT_SAVED("PeriodResultSaved", AuditAggregate.PERIOD),
    PERIOD_LOCKED("PeriodLocked", AuditAggregate.PERIOD),
    ACCOUNT_CREATED("AccountCreated", AuditAggregate.ACCOUNT),
    ACCOUNT_DELETED("AccountDeleted", AuditAggregate.ACCOUNT),
    GENERAL_BALANCES_ROLLED_UP("GeneralBalancesRolledUp", AuditAggregate.CHART);

    private final String eventName;
    private final AuditAggregate aggregate;

    AuditEventType(String eventName, AuditAggregate aggregate) {
        this.eventName = eventName;
        this.aggregate = aggregate;
    }

    public String getEventName() {
        return eventName;
    }

    public AuditAggregate getAggregate() {
        return aggregate;
    }
}
