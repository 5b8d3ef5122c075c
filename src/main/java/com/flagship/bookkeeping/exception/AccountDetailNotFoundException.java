package com.flagship.bookkeeping.exception;

import java.util.Map;

/**
 * A journal entry names a Detail account that no longer resolves. Journal entries
 * reference accounts by number, so this is caught on read rather than by a
 * foreign key.
 */
public class AccountDetailNotFoundException extends BookkeepingException {

    public AccountDetailNotFoundException(String accountNumber) {
        super(ErrorCategory.INTEGRITY, "ACCOUNT_DETAIL_NOT_FOUND",
                "Detail account " + accountNumber + " referenced by a journal entry does not exist",
                Map.of("accountNumber", accountNumber));
    }
}
