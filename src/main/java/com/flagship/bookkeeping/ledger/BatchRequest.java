package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.money.Money;
import lombok.Value;

import java.util.List;

/**
 * An ordered batch of ledger lines submitted together under one reference.
 */
@Value
public class BatchRequest {
    List<BatchLine> lines;

    public BatchRequest(List<BatchLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A ledger batch needs at least one line");
        }
        this.lines = List.copyOf(lines);
    }

    public static BatchRequest of(BatchLine... lines) {
        return new BatchRequest(List.of(lines));
    }

    public Money getDebitTotal() {
        return total(EntryType.DEBIT);
    }

    public Money getCreditTotal() {
        return total(EntryType.CREDIT);
    }

    public boolean isBalanced() {
        return getDebitTotal().isEqualTo(getCreditTotal());
    }

    private Money total(EntryType type) {
        Money sum = Money.ZERO;
        for (BatchLine line : lines) {
            if (line.getEntryType() == type) {
                sum = sum.add(line.getAmount());
            }
        }
        return sum;
    }
}
