package com.flagship.bookkeeping.account;

import com.flagship.bookkeeping.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a General or Detail account row.
 *
 * {@code generalAccountId} and {@code generalAccountNumber} are set only for
 * Detail accounts and point at the parent.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    UUID id;
    AccountKind kind;
    AccountNumber accountNumber;
    String accountName;
    AccountCategory category;
    ReportType reportType;
    NormalSide normalSide;

    UUID generalAccountId;
    String generalAccountNumber;

    Money amountCredit;
    Money amountDebit;
    Money accumulationAmountCredit;
    Money accumulationAmountDebit;
    Money initialAmountCredit;
    Money initialAmountDebit;

    String createdBy;
    String updatedBy;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    public String getNumber() {
        return accountNumber.getNumber();
    }

    public AccountRef toRef() {
        return new AccountRef(kind, id);
    }

    public boolean isActive() {
        return deletedAt == null;
    }

    /** Cumulative amount on the account's normal side. */
    public Money normalSideAmount() {
        return normalSide == NormalSide.CREDIT ? amountCredit : amountDebit;
    }
}
