package com.flagship.bookkeeping.exception;

import java.util.Map;

public class BatchNotFoundException extends BookkeepingException {

    public BatchNotFoundException(String referenceNumber) {
        super(ErrorCategory.NOT_FOUND, "BATCH_NOT_FOUND",
                "Ledger batch " + referenceNumber + " not found",
                Map.of("referenceNumber", referenceNumber));
    }
}
