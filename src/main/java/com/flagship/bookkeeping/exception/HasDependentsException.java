package com.flagship.bookkeeping.exception;

import java.util.Map;

public class HasDependentsException extends BookkeepingException {

    public HasDependentsException(String kind, String accountNumber, long ledgerEntries, long childAccounts) {
        super(ErrorCategory.INTEGRITY, "HAS_DEPENDENTS",
                String.format("%s account %s cannot be deleted: %d ledger entr%s, %d child account(s)",
                        kind, accountNumber, ledgerEntries, ledgerEntries == 1 ? "y" : "ies", childAccounts),
                Map.of("accountNumber", accountNumber,
                        "ledgerEntries", ledgerEntries,
                        "childAccounts", childAccounts));
    }
}
