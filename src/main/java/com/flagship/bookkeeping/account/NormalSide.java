package com.flagship.bookkeeping.account;

/**
 * The side on which an account's balance naturally grows.
 */
public enum NormalSide {
    DEBIT,
    CREDIT
}
