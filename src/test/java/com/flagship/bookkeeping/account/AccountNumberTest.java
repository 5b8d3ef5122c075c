package com.flagship.bookkeeping.account;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountNumberTest {

    @Test
    @DisplayName("Active numbers are trimmed and render as themselves")
    void testActiveNumber() {
        AccountNumber number = AccountNumber.active(" 1101 ");

        assertTrue(number.isActive());
        assertEquals("1101", number.getNumber());
        assertEquals("1101", number.toString());
    }

    @Test
    @DisplayName("Tombstoning keeps the original number and frees it for reuse")
    void testTombstoneFreesNumber() {
        AccountNumber original = AccountNumber.active("1101");
        AccountNumber deleted = original.tombstone("deleted-1700000000000");
        AccountNumber replacement = AccountNumber.active("1101");

        assertFalse(deleted.isActive());
        assertEquals("1101", deleted.getNumber());
        assertEquals("1101~deleted-1700000000000", deleted.toString());
        assertTrue(original.collidesWith(replacement));
        assertFalse(deleted.collidesWith(replacement));
    }

    @Test
    @DisplayName("A deleted number cannot be deleted again")
    void testDoubleTombstoneRejected() {
        AccountNumber deleted = AccountNumber.of("1101", "deleted-1");

        assertThrows(IllegalStateException.class, () -> deleted.tombstone("deleted-2"));
    }

    @Test
    @DisplayName("Blank numbers and suffixes are rejected")
    void testBlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> AccountNumber.active(" "));
        assertThrows(IllegalArgumentException.class, () -> AccountNumber.active("1101").tombstone(""));
    }
}
