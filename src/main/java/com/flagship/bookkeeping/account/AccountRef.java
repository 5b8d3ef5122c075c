package com.flagship.bookkeeping.account;

import lombok.Value;

import java.util.UUID;

@Value
public class AccountRef {
    AccountKind kind;
    UUID id;

    public static AccountRef general(UUID id) {
        return new AccountRef(AccountKind.GENERAL, id);
    }

    public static AccountRef detail(UUID id) {
        return new AccountRef(AccountKind.DETAIL, id);
    }
}
