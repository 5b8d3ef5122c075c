package com.flagship.bookkeeping.exception;

import java.util.Map;

/**
 * Generated batch reference already exists. The batch is rejected whole; retry
 * the submission to get a fresh reference.
 */
public class ReferenceCollisionException extends BookkeepingException {

    public ReferenceCollisionException(String referenceNumber) {
        super(ErrorCategory.STATE_CONFLICT, "REFERENCE_COLLISION",
                "Batch reference " + referenceNumber + " is already in use",
                Map.of("referenceNumber", referenceNumber));
    }
}
