package com.flagship.bookkeeping.exception;

import java.util.Map;

/**
 * There are no active income-statement Detail accounts to compute a net result from.
 */
public class NoResultAccountsException extends BookkeepingException {

    public NoResultAccountsException(int year) {
        super(ErrorCategory.NOT_FOUND, "NO_RESULT_ACCOUNTS",
                "No active income statement accounts found for period " + year,
                Map.of("year", year));
    }
}
