package com.flagship.bookkeeping.balance;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

/**
 * What one balance application or reversal did to one Detail account.
 * Deltas are always non-negative; the direction is given by the operation.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountBalanceChange {
    String accountNumber;
    String accountName;
    Money debitDelta;
    Money creditDelta;
    Money amountDebit;
    Money amountCredit;
}
