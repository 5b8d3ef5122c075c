package com.flagship.bookkeeping.audit;

/**
 * What an audit event is about. The aggregate key is the Kafka message key, so
 * all events for one batch, day, period or account stay on one partition.
 */
public enum AuditAggregate {
    LEDGER_BATCH("LedgerBatch"),
    LEDGER_DAY("LedgerDay"),
    PERIOD("Period"),
    ACCOUNT("Account"),
    CHART("Chart");

    private final String typeName;

    AuditAggregate(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
