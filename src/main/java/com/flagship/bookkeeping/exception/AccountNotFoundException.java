package com.flagship.bookkeeping.exception;

import java.util.Map;

public class AccountNotFoundException extends BookkeepingException {

    public AccountNotFoundException(String kind, String accountNumber) {
        super(ErrorCategory.NOT_FOUND, "ACCOUNT_NOT_FOUND",
                "No active " + kind + " account with number " + accountNumber,
                Map.of("kind", kind, "accountNumber", accountNumber));
    }
}
