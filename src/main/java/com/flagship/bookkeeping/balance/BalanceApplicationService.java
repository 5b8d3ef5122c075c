package com.flagship.bookkeeping.balance;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountKind;
import com.flagship.bookkeeping.account.AccountStore;
import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.closing.PeriodLockGuard;
import com.flagship.bookkeeping.exception.AccountDetailNotFoundException;
import com.flagship.bookkeeping.exception.BookkeepingException;
import com.flagship.bookkeeping.exception.NothingToPostException;
import com.flagship.bookkeeping.exception.NothingToUnpostException;
import com.flagship.bookkeeping.journal.JournalEntryEntity;
import com.flagship.bookkeeping.journal.JournalEntryRepository;
import com.flagship.bookkeeping.ledger.PostingStatus;
import com.flagship.bookkeeping.money.Money;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import com.flagship.bookkeeping.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Realizes journal entries into Detail account balances and reverts them.
 *
 * Application walks every PENDING journal entry up to a date, adds its totals
 * to the Detail account it names, and marks it POSTED. Reversal takes the
 * POSTED entries of one date back out. Journal entries name accounts by number,
 * so every number is resolved before anything is written; a missing account
 * aborts the whole pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceApplicationService {

    private final JournalEntryRepository journalEntryRepository;
    private final AccountStore accountStore;
    private final PeriodLockGuard periodLockGuard;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;
    private final Clock clock;

    @Transactional
    public BalanceApplicationResult applyBalancesUpTo(LocalDate date, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.POSTING_DATE_MDC_KEY, date.toString());
        try {
            List<JournalEntryEntity> journals =
                journalEntryRepository.lockByStatusUpTo(PostingStatus.PENDING, date);
            if (journals.isEmpty()) {
                throw new NothingToPostException(date, "journal entries");
            }
            assertYearsOpen(journals);

            Map<String, Totals> perAccount = totalsPerAccount(journals);
            Map<String, Account> accounts = resolveAccounts(perAccount);

            List<AccountBalanceChange> changes = new ArrayList<>(perAccount.size());
            for (Map.Entry<String, Totals> entry : perAccount.entrySet()) {
                Account account = accounts.get(entry.getKey());
                Totals totals = entry.getValue();
                accountStore.incrementBalances(account.toRef(), totals.credit, totals.debit, actorId);
                changes.add(changeFor(account, totals));
            }

            Instant appliedAt = Instant.now(clock);
            journals.forEach(journal -> journal.markPosted(appliedAt, actorId));
            journalEntryRepository.saveAll(journals);

            BalanceApplicationResult result = new BalanceApplicationResult(date, journals.size(), changes, appliedAt);
            auditTrailService.record(AuditEventType.BALANCES_APPLIED, date.toString(), actorId, result);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("apply_balances", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            log.info("Applied balances: journalEntries={}, accounts={}, duration={}ms",
                    journals.size(), changes.size(), duration);

            return result;

        } catch (BookkeepingException e) {
            metrics.recordOperation("apply_balances", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Balance application rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.POSTING_DATE_MDC_KEY);
        }
    }

    @Transactional
    public BalanceApplicationResult revertBalancesFor(LocalDate date, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.POSTING_DATE_MDC_KEY, date.toString());
        try {
            List<JournalEntryEntity> journals =
                journalEntryRepository.lockByStatusOn(PostingStatus.POSTED, date);
            if (journals.isEmpty()) {
                throw new NothingToUnpostException(date, "journal entries");
            }
            periodLockGuard.assertYearOpen(date.getYear());

            Map<String, Totals> perAccount = totalsPerAccount(journals);
            Map<String, Account> accounts = resolveAccounts(perAccount);

            List<AccountBalanceChange> changes = new ArrayList<>(perAccount.size());
            for (Map.Entry<String, Totals> entry : perAccount.entrySet()) {
                Account account = accounts.get(entry.getKey());
                Totals totals = entry.getValue();
                accountStore.decrementBalances(account.toRef(), totals.credit, totals.debit, actorId);
                changes.add(changeFor(account, totals));
            }

            journals.forEach(journal -> journal.markPending(actorId));
            journalEntryRepository.saveAll(journals);

            BalanceApplicationResult result =
                new BalanceApplicationResult(date, journals.size(), changes, Instant.now(clock));
            auditTrailService.record(AuditEventType.BALANCES_REVERTED, date.toString(), actorId, result);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("revert_balances", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            log.info("Reverted balances: journalEntries={}, accounts={}, duration={}ms",
                    journals.size(), changes.size(), duration);

            return result;

        } catch (BookkeepingException e) {
            metrics.recordOperation("revert_balances", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Balance reversal rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.POSTING_DATE_MDC_KEY);
        }
    }

    private void assertYearsOpen(List<JournalEntryEntity> journals) {
        journals.stream()
            .map(journal -> journal.getLedgerDate().getYear())
            .distinct()
            .forEach(periodLockGuard::assertYearOpen);
    }

    private static Map<String, Totals> totalsPerAccount(List<JournalEntryEntity> journals) {
        Map<String, Totals> perAccount = new LinkedHashMap<>();
        for (JournalEntryEntity journal : journals) {
            perAccount.computeIfAbsent(journal.getDetailAccountNumber(), n -> new Totals())
                .add(journal.debit(), journal.credit());
        }
        return perAccount;
    }

    private Map<String, Account> resolveAccounts(Map<String, Totals> perAccount) {
        Map<String, Account> accounts = accountStore.findActiveByNumbers(AccountKind.DETAIL, perAccount.keySet());
        for (String number : perAccount.keySet()) {
            if (!accounts.containsKey(number)) {
                throw new AccountDetailNotFoundException(number);
            }
        }
        return accounts;
    }

    private AccountBalanceChange changeFor(Account before, Totals totals) {
        Account after = accountStore.findActiveById(AccountKind.DETAIL, before.getId())
            .orElseThrow(() -> new AccountDetailNotFoundException(before.getNumber()));
        return new AccountBalanceChange(
            after.getNumber(),
            after.getAccountName(),
            totals.debit,
            totals.credit,
            after.getAmountDebit(),
            after.getAmountCredit());
    }

    private static final class Totals {
        private Money debit = Money.ZERO;
        private Money credit = Money.ZERO;

        private void add(Money debitDelta, Money creditDelta) {
            debit = debit.add(debitDelta);
            credit = credit.add(creditDelta);
        }
    }
}
