package com.flagship.bookkeeping.balance;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.bookkeeping.money.Money;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GeneralAccountRollup {
    String generalAccountNumber;
    int detailAccounts;
    Money amountDebit;
    Money amountCredit;
}
