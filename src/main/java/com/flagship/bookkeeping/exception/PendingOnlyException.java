package com.flagship.bookkeeping.exception;

import java.util.Map;

public class PendingOnlyException extends BookkeepingException {

    public PendingOnlyException(String referenceNumber, int postedLines) {
        super(ErrorCategory.STATE_CONFLICT, "PENDING_ONLY",
                "Batch " + referenceNumber + " has " + postedLines + " posted line(s); only PENDING batches can be deleted",
                Map.of("referenceNumber", referenceNumber, "postedLines", postedLines));
    }
}
