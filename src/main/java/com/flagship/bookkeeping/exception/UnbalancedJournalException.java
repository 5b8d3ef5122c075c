package com.flagship.bookkeeping.exception;

import com.flagship.bookkeeping.money.Money;

import java.util.Map;

public class UnbalancedJournalException extends BookkeepingException {

    private final Money debitTotal;
    private final Money creditTotal;

    public UnbalancedJournalException(Money debitTotal, Money creditTotal) {
        super(ErrorCategory.VALIDATION, "UNBALANCED_JOURNAL",
                String.format("Journal is not balanced: debit=%s, credit=%s", debitTotal, creditTotal),
                Map.of("debit", debitTotal.toString(), "credit", creditTotal.toString()));
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }

    public Money getDebitTotal() {
        return debitTotal;
    }

    public Money getCreditTotal() {
        return creditTotal;
    }
}
