package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.exception.InvalidAmountException;
import com.flagship.bookkeeping.money.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One proposed movement in a batch. Amounts are strictly positive; the
 * direction is carried by {@link EntryType}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BatchLine {
    String detailAccountNumber;
    String generalAccountNumber;
    EntryType entryType;
    Money amount;
    String description;
    LocalDateTime ledgerDate;

    public static BatchLine of(String detailAccountNumber, String generalAccountNumber, EntryType entryType,
                               Money amount, String description, LocalDateTime ledgerDate) {
        Objects.requireNonNull(detailAccountNumber, "detailAccountNumber");
        Objects.requireNonNull(generalAccountNumber, "generalAccountNumber");
        Objects.requireNonNull(entryType, "entryType");
        Objects.requireNonNull(ledgerDate, "ledgerDate");
        if (amount == null || !amount.isPositive()) {
            throw new InvalidAmountException(String.valueOf(amount));
        }
        return new BatchLine(detailAccountNumber.trim(), generalAccountNumber.trim(), entryType,
                amount, description, ledgerDate);
    }

    public static BatchLine debit(String detailAccountNumber, String generalAccountNumber, String amount,
                                  LocalDateTime ledgerDate) {
        return of(detailAccountNumber, generalAccountNumber, EntryType.DEBIT, Money.of(amount), null, ledgerDate);
    }

    public static BatchLine credit(String detailAccountNumber, String generalAccountNumber, String amount,
                                   LocalDateTime ledgerDate) {
        return of(detailAccountNumber, generalAccountNumber, EntryType.CREDIT, Money.of(amount), null, ledgerDate);
    }
}
