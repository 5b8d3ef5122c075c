package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountKind;
import com.flagship.bookkeeping.account.AccountStore;
import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.AccountRelationMismatchException;
import com.flagship.bookkeeping.exception.AccountsNotFoundException;
import com.flagship.bookkeeping.exception.BookkeepingException;
import com.flagship.bookkeeping.exception.ReferenceCollisionException;
import com.flagship.bookkeeping.exception.UnbalancedJournalException;
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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and stores a batch of ledger lines as PENDING.
 *
 * Checks run in order and each reports every offender it finds:
 * 1. every Detail and General number resolves to an active account
 * 2. every line's General account is its Detail account's parent
 * 3. debits equal credits
 * 4. the generated reference is unused
 * All of it, including the insert, happens in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerIntakeService {

    private static final String OPERATION = "submit_batch";

    private final AccountStore accountStore;
    private final LedgerEntryStore ledgerEntryStore;
    private final ReferenceNumberGenerator referenceNumberGenerator;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;
    private final Clock clock;

    @Transactional
    public BatchReceipt submitBatch(BatchRequest request, String actorId) {
        long startTime = System.currentTimeMillis();
        try {
            List<LedgerEntryStore.ResolvedLine> resolved = resolveAccounts(request.getLines());
            verifyRelations(resolved);

            Money debitTotal = request.getDebitTotal();
            Money creditTotal = request.getCreditTotal();
            if (!debitTotal.isEqualTo(creditTotal)) {
                throw new UnbalancedJournalException(debitTotal, creditTotal);
            }

            String referenceNumber = referenceNumberGenerator.next();
            MDC.put(CorrelationContext.BATCH_REF_MDC_KEY, referenceNumber);
            if (ledgerEntryStore.referenceExists(referenceNumber)) {
                throw new ReferenceCollisionException(referenceNumber);
            }

            ledgerEntryStore.insertBatch(referenceNumber, resolved, debitTotal, creditTotal, actorId);

            BatchReceipt receipt = new BatchReceipt(referenceNumber, resolved.size(), debitTotal, creditTotal,
                    Instant.now(clock));

            auditTrailService.record(AuditEventType.BATCH_SUBMITTED, referenceNumber, actorId, receipt);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            metrics.recordLedgerLines("submitted", resolved.size());
            log.info("Ledger batch accepted: lines={}, debit={}, credit={}, duration={}ms",
                    resolved.size(), debitTotal, creditTotal, duration);

            return receipt;

        } catch (BookkeepingException e) {
            metrics.recordOperation(OPERATION, BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Ledger batch rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.BATCH_REF_MDC_KEY);
        }
    }

    private List<LedgerEntryStore.ResolvedLine> resolveAccounts(List<BatchLine> lines) {
        Set<String> detailNumbers = new LinkedHashSet<>();
        Set<String> generalNumbers = new LinkedHashSet<>();
        for (BatchLine line : lines) {
            detailNumbers.add(line.getDetailAccountNumber());
            generalNumbers.add(line.getGeneralAccountNumber());
        }

        Map<String, Account> details = accountStore.findActiveByNumbers(AccountKind.DETAIL, detailNumbers);
        Map<String, Account> generals = accountStore.findActiveByNumbers(AccountKind.GENERAL, generalNumbers);

        List<String> missingDetails = detailNumbers.stream().filter(n -> !details.containsKey(n)).toList();
        List<String> missingGenerals = generalNumbers.stream().filter(n -> !generals.containsKey(n)).toList();
        if (!missingDetails.isEmpty() || !missingGenerals.isEmpty()) {
            throw new AccountsNotFoundException(missingDetails, missingGenerals);
        }

        List<LedgerEntryStore.ResolvedLine> resolved = new ArrayList<>(lines.size());
        for (BatchLine line : lines) {
            resolved.add(new LedgerEntryStore.ResolvedLine(
                    line,
                    details.get(line.getDetailAccountNumber()),
                    generals.get(line.getGeneralAccountNumber())));
        }
        return resolved;
    }

    private void verifyRelations(List<LedgerEntryStore.ResolvedLine> lines) {
        List<AccountRelationMismatchException.Violation> violations = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            LedgerEntryStore.ResolvedLine line = lines.get(i);
            Account detail = line.getDetailAccount();
            Account general = line.getGeneralAccount();
            if (!general.getId().equals(detail.getGeneralAccountId())) {
                violations.add(new AccountRelationMismatchException.Violation(
                        i, detail.getNumber(), general.getNumber(), detail.getGeneralAccountNumber()));
            }
        }
        if (!violations.isEmpty()) {
            throw new AccountRelationMismatchException(violations);
        }
    }
}
