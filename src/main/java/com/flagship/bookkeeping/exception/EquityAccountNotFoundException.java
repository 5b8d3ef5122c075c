package com.flagship.bookkeeping.exception;

import java.util.Map;

public class EquityAccountNotFoundException extends BookkeepingException {

    public EquityAccountNotFoundException(String accountNumber) {
        super(ErrorCategory.INTEGRITY, "EQUITY_ACCOUNT_NOT_FOUND",
                "Equity account " + accountNumber + " for the period net result does not exist",
                Map.of("accountNumber", accountNumber));
    }
}
