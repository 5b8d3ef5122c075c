package com.flagship.bookkeeping.exception;

import java.util.Map;

public class AccountExistsException extends BookkeepingException {

    public AccountExistsException(String kind, String accountNumber) {
        super(ErrorCategory.STATE_CONFLICT, "ACCOUNT_EXISTS",
                "An active " + kind + " account with number " + accountNumber + " already exists",
                Map.of("kind", kind, "accountNumber", accountNumber));
    }
}
