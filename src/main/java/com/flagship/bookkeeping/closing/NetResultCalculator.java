package com.flagship.bookkeeping.closing;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.NormalSide;
import com.flagship.bookkeeping.money.Money;

import java.util.List;

/**
 * Credit-normal accounts count as revenue with their cumulative credit;
 * debit-normal accounts count as expense with their cumulative debit. Balances
 * are all-time cumulative figures, not movements of a single year.
 */
public final class NetResultCalculator {

    private NetResultCalculator() {
    }

    public static NetResult calculate(List<Account> incomeStatementAccounts) {
        Money revenue = Money.ZERO;
        Money expense = Money.ZERO;
        for (Account account : incomeStatementAccounts) {
            if (account.getNormalSide() == NormalSide.CREDIT) {
                revenue = revenue.add(account.getAmountCredit());
            } else {
                expense = expense.add(account.getAmountDebit());
            }
        }
        return new NetResult(revenue, expense, revenue.subtract(expense), incomeStatementAccounts.size());
    }
}
