package com.flagship.bookkeeping.account;

import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.AccountExistsException;
import com.flagship.bookkeeping.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Chart-of-accounts maintenance: create and soft-delete General and Detail accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountStore accountStore;
    private final AuditTrailService auditTrailService;

    @Transactional
    public Account createGeneralAccount(NewAccountRequest request, String actorId) {
        requireNumberFree(AccountKind.GENERAL, request.getAccountNumber());
        Account account = insert(AccountKind.GENERAL, request, null, actorId);
        log.info("Created general account {} ({})", account.getNumber(), account.getCategory());
        return account;
    }

    /**
     * @throws AccountNotFoundException if the parent General account is missing or deleted
     */
    @Transactional
    public Account createDetailAccount(NewAccountRequest request, String actorId) {
        if (request.getGeneralAccountNumber() == null || request.getGeneralAccountNumber().isBlank()) {
            throw new IllegalArgumentException("A detail account needs a general_account_number");
        }
        requireNumberFree(AccountKind.DETAIL, request.getAccountNumber());
        Account parent = accountStore.findActiveByNumber(AccountKind.GENERAL, request.getGeneralAccountNumber())
            .orElseThrow(() -> new AccountNotFoundException(AccountKind.GENERAL.label(),
                    request.getGeneralAccountNumber()));

        Account account = insert(AccountKind.DETAIL, request, parent.getId(), actorId);
        log.info("Created detail account {} under {}", account.getNumber(), parent.getNumber());
        return account;
    }

    @Transactional(readOnly = true)
    public Account findAccount(AccountKind kind, String accountNumber) {
        return accountStore.findActiveByNumber(kind, accountNumber)
            .orElseThrow(() -> new AccountNotFoundException(kind.label(), accountNumber));
    }

    @Transactional
    public Account deleteAccount(AccountKind kind, String accountNumber, String actorId) {
        Account account = findAccount(kind, accountNumber);
        Account deleted = accountStore.softDelete(account.toRef(), actorId);
        auditTrailService.record(AuditEventType.ACCOUNT_DELETED, account.getId().toString(), actorId,
                Map.of("kind", kind.name(),
                        "accountNumber", account.getNumber(),
                        "tombstone", deleted.getAccountNumber().toString()));
        return deleted;
    }

    private Account insert(AccountKind kind, NewAccountRequest request, UUID parentId, String actorId) {
        Account account;
        try {
            account = accountStore.insert(kind, request, parentId, actorId);
        } catch (DuplicateKeyException e) {
            throw new AccountExistsException(kind.label(), request.getAccountNumber());
        }
        auditTrailService.record(AuditEventType.ACCOUNT_CREATED, account.getId().toString(), actorId,
                Map.of("kind", kind.name(),
                        "accountNumber", account.getNumber(),
                        "category", account.getCategory().name()));
        return account;
    }

    private void requireNumberFree(AccountKind kind, String accountNumber) {
        if (accountStore.findActiveByNumber(kind, accountNumber.trim()).isPresent()) {
            throw new AccountExistsException(kind.label(), accountNumber);
        }
    }
}
