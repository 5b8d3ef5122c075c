package com.flagship.bookkeeping.exception;

import java.util.Map;
import java.util.UUID;

public class JournalEntryNotFoundException extends BookkeepingException {

    public JournalEntryNotFoundException(UUID id) {
        super(ErrorCategory.NOT_FOUND, "JOURNAL_ENTRY_NOT_FOUND",
                "Journal entry " + id + " not found",
                Map.of("id", id.toString()));
    }
}
