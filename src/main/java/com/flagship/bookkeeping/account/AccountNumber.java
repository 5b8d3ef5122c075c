package com.flagship.bookkeeping.account;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Account number in one of two states: Active{number} or
 * Deleted{originalNumber, tombstoneSuffix}.
 *
 * The stored number never changes. Deleting an account attaches a tombstone
 * suffix instead of rewriting the number, and only active numbers take part in
 * the uniqueness rule (partial unique index on {@code deleted_at IS NULL}).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountNumber {

    private static final String TOMBSTONE_SEPARATOR = "~";

    String number;
    String tombstoneSuffix;

    public static AccountNumber active(String number) {
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("Account number must not be blank");
        }
        return new AccountNumber(number.trim(), null);
    }

    public static AccountNumber of(String number, String tombstoneSuffix) {
        AccountNumber active = active(number);
        return tombstoneSuffix == null ? active : active.tombstone(tombstoneSuffix);
    }

    public boolean isActive() {
        return tombstoneSuffix == null;
    }

    /**
     * Moves this number to the Deleted state.
     *
     * @throws IllegalStateException if the number is already tombstoned
     */
    public AccountNumber tombstone(String suffix) {
        if (!isActive()) {
            throw new IllegalStateException("Account number " + number + " is already deleted");
        }
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("Tombstone suffix must not be blank");
        }
        return new AccountNumber(number, suffix);
    }

    /**
     * Two numbers collide only when both are active and equal.
     */
    public boolean collidesWith(AccountNumber other) {
        return isActive() && other.isActive() && number.equals(other.number);
    }

    @Override
    public String toString() {
        return isActive() ? number : number + TOMBSTONE_SEPARATOR + tombstoneSuffix;
    }
}
