package com.flagship.bookkeeping.closing;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

/**
 * Revenue minus expense over a set of income statement accounts.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NetResult {
    Money totalRevenue;
    Money totalExpense;
    Money netResult;
    int accountsProcessed;

    /** Credit half of the signed result: the result when positive, else zero. */
    public Money creditComponent() {
        return netResult.positivePart();
    }

    /** Debit half of the signed result: the absolute loss, else zero. */
    public Money debitComponent() {
        return netResult.negate().positivePart();
    }
}
