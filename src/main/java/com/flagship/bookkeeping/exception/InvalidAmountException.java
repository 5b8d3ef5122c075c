package com.flagship.bookkeeping.exception;

import java.util.Map;

public class InvalidAmountException extends BookkeepingException {

    public InvalidAmountException(String rawValue) {
        super(ErrorCategory.VALIDATION, "INVALID_AMOUNT",
                "Invalid monetary amount: '" + rawValue + "'",
                Map.of("value", String.valueOf(rawValue)));
    }
}
