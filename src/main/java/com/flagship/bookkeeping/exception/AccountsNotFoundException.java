package com.flagship.bookkeeping.exception;

import java.util.List;
import java.util.Map;

/**
 * One or more account numbers in a batch do not resolve to an active account.
 * Both lists are complete, not just the first miss.
 */
public class AccountsNotFoundException extends BookkeepingException {

    private final List<String> missingDetailNumbers;
    private final List<String> missingGeneralNumbers;

    public AccountsNotFoundException(List<String> missingDetailNumbers, List<String> missingGeneralNumbers) {
        super(ErrorCategory.VALIDATION, "ACCOUNTS_NOT_FOUND",
                String.format("Accounts not found: detail=%s, general=%s",
                        missingDetailNumbers, missingGeneralNumbers),
                Map.of("missingDetailAccounts", List.copyOf(missingDetailNumbers),
                        "missingGeneralAccounts", List.copyOf(missingGeneralNumbers)));
        this.missingDetailNumbers = List.copyOf(missingDetailNumbers);
        this.missingGeneralNumbers = List.copyOf(missingGeneralNumbers);
    }

    public List<String> getMissingDetailNumbers() {
        return missingDetailNumbers;
    }

    public List<String> getMissingGeneralNumbers() {
        return missingGeneralNumbers;
    }
}
