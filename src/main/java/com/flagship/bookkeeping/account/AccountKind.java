package com.flagship.bookkeeping.account;

/**
 * General accounts are parents; Detail accounts carry the movements.
 */
public enum AccountKind {
    GENERAL("general_accounts", "General"),
    DETAIL("detail_accounts", "Detail");

    private final String tableName;
    private final String label;

    AccountKind(String tableName, String label) {
        this.tableName = tableName;
        this.label = label;
    }

    String tableName() {
        return tableName;
    }

    public String label() {
        return label;
    }
}
