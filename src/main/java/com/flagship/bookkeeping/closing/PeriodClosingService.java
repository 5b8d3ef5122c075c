package com.flagship.bookkeeping.closing;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountKind;
import com.flagship.bookkeeping.account.AccountStore;
import com.flagship.bookkeeping.account.ReportType;
import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.BookkeepingException;
import com.flagship.bookkeeping.exception.EquityAccountNotFoundException;
import com.flagship.bookkeeping.exception.NoResultAccountsException;
import com.flagship.bookkeeping.exception.PeriodClosedException;
import com.flagship.bookkeeping.exception.PeriodResultNotFoundException;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import com.flagship.bookkeeping.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes, saves and locks the yearly net result.
 *
 * Saving overwrites the equity account's accumulation pair with the signed
 * result split into credit (profit) and debit (loss) halves. That is the one
 * absolute write to a Detail account: the figure is a snapshot, recomputed in
 * full each time. A closed year accepts no further save and no balance
 * application or reversal.
 */
@Service
@Slf4j
public class PeriodClosingService {

    private final PeriodResultRepository periodResultRepository;
    private final AccountStore accountStore;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;
    private final Clock clock;
    private final String equityAccountNumber;

    public PeriodClosingService(PeriodResultRepository periodResultRepository,
                                AccountStore accountStore,
                                AuditTrailService auditTrailService,
                                BookkeepingMetrics metrics,
                                Clock clock,
                                @Value("${bookkeeping.closing.equity-account-number:3203}") String equityAccountNumber) {
        this.periodResultRepository = periodResultRepository;
        this.accountStore = accountStore;
        this.auditTrailService = auditTrailService;
        this.metrics = metrics;
        this.clock = clock;
        this.equityAccountNumber = equityAccountNumber;
    }

    /**
     * Computes the net result for the year without writing anything.
     */
    @Transactional(readOnly = true)
    public PeriodResultCalculation calculatePeriodResult(int year) {
        NetResult result = computeNetResult(year);
        PeriodResult existing = periodResultRepository.findByPeriodYear(year)
            .map(PeriodResultEntity::toDomain)
            .orElse(null);
        boolean canSave = existing == null || !existing.isClosed();
        return new PeriodResultCalculation(year, result, existing, canSave);
    }

    @Transactional(readOnly = true)
    public PeriodResult findPeriodResult(int year) {
        return periodResultRepository.findByPeriodYear(year)
            .map(PeriodResultEntity::toDomain)
            .orElseThrow(() -> new PeriodResultNotFoundException(year));
    }

    /**
     * Upserts the year's period result and overwrites the equity account's
     * accumulation pair with it.
     *
     * @throws PeriodClosedException if the year is already closed
     * @throws NoResultAccountsException if there are no income statement accounts
     * @throws EquityAccountNotFoundException if the configured equity account is missing
     */
    @Transactional
    public PeriodCloseResult closePeriod(int year, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PERIOD_YEAR_MDC_KEY, String.valueOf(year));
        try {
            Optional<PeriodResultEntity> existing = periodResultRepository.lockByPeriodYear(year);
            if (existing.isPresent() && existing.get().isClosed()) {
                throw new PeriodClosedException(year);
            }

            NetResult result = computeNetResult(year);
            Account equity = accountStore.findActiveByNumber(AccountKind.DETAIL, equityAccountNumber)
                .orElseThrow(() -> new EquityAccountNotFoundException(equityAccountNumber));

            PeriodResultOperation operation;
            if (existing.isPresent()) {
                existing.get().recalculate(result, equity.getId(), equity.getNumber(),
                        equity.getGeneralAccountNumber(), actorId);
                periodResultRepository.saveAndFlush(existing.get());
                operation = PeriodResultOperation.UPDATED;
            } else {
                try {
                    periodResultRepository.saveAndFlush(PeriodResultEntity.create(year, result, equity.getId(),
                            equity.getNumber(), equity.getGeneralAccountNumber(), actorId));
                } catch (DataIntegrityViolationException e) {
                    throw new OptimisticLockingFailureException(
                        "Period result for " + year + " was created concurrently", e);
                }
                operation = PeriodResultOperation.CREATED;
            }

            accountStore.overwriteAccumulation(equity.toRef(), result.creditComponent(), result.debitComponent(),
                    actorId);

            PeriodCloseResult closeResult = new PeriodCloseResult(year, result.getNetResult(), operation,
                    equity.getNumber(), result.creditComponent(), result.debitComponent(), Instant.now(clock));
            auditTrailService.record(AuditEventType.PERIOD_RESULT_SAVED, String.valueOf(year), actorId, closeResult);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("close_period", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            log.info("Period result {}: netResult={}, revenue={}, expense={}, accounts={}, duration={}ms",
                    operation, result.getNetResult(), result.getTotalRevenue(), result.getTotalExpense(),
                    result.getAccountsProcessed(), duration);

            return closeResult;

        } catch (BookkeepingException e) {
            metrics.recordOperation("close_period", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Period close rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PERIOD_YEAR_MDC_KEY);
        }
    }

    /**
     * Sets the one-way closed flag on the year's saved result.
     */
    @Transactional
    public PeriodResult lockPeriod(int year, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PERIOD_YEAR_MDC_KEY, String.valueOf(year));
        try {
            PeriodResultEntity entity = periodResultRepository.lockByPeriodYear(year)
                .orElseThrow(() -> new PeriodResultNotFoundException(year));
            if (entity.isClosed()) {
                throw new PeriodClosedException(year);
            }

            entity.close(Instant.now(clock), actorId);
            PeriodResult locked = periodResultRepository.saveAndFlush(entity).toDomain();

            auditTrailService.record(AuditEventType.PERIOD_LOCKED, String.valueOf(year), actorId,
                    Map.of("year", year, "amount", locked.getAmount().toString()));
            metrics.recordOperation("lock_period", BookkeepingMetrics.OUTCOME_SUCCESS,
                    System.currentTimeMillis() - startTime);
            log.info("Period {} closed with net result {}", year, locked.getAmount());
            return locked;
        } catch (BookkeepingException e) {
            metrics.recordOperation("lock_period", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Period lock rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PERIOD_YEAR_MDC_KEY);
        }
    }

    private NetResult computeNetResult(int year) {
        List<Account> accounts = accountStore.findActiveDetailsByReportType(ReportType.INCOME_STATEMENT);
        if (accounts.isEmpty()) {
            throw new NoResultAccountsException(year);
        }
        return NetResultCalculator.calculate(accounts);
    }
}
