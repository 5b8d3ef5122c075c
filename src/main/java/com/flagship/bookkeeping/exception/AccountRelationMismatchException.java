package com.flagship.bookkeeping.exception;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Lines whose General account is not the parent of their Detail account.
 */
public class AccountRelationMismatchException extends BookkeepingException {

    private final List<Violation> violations;

    public AccountRelationMismatchException(List<Violation> violations) {
        super(ErrorCategory.VALIDATION, "ACCOUNT_RELATION_MISMATCH",
                violations.size() + " line(s) reference a General account that is not the Detail account's parent",
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    @Value
    public static class Violation {
        int lineIndex;
        String detailAccountNumber;
        String generalAccountNumber;
        String actualParentNumber;
    }
}
