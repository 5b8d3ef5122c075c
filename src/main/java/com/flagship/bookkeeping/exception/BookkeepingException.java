package com.flagship.bookkeeping.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of every failure raised by the bookkeeping engines.
 *
 * Unchecked, so any throw inside a {@code @Transactional} method rolls the whole
 * operation back. Subclasses supply a stable {@code code} for API clients and a
 * detail map with the offending values.
 */
public abstract class BookkeepingException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;
    private final Map<String, Object> details;

    protected BookkeepingException(ErrorCategory category, String code, String message) {
        this(category, code, message, Map.of());
    }

    protected BookkeepingException(ErrorCategory category, String code, String message,
                                   Map<String, ?> details) {
        super(message);
        this.category = category;
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
