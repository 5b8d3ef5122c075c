package com.flagship.bookkeeping.posting;

import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.AlreadyPostedException;
import com.flagship.bookkeeping.exception.BookkeepingException;
import com.flagship.bookkeeping.exception.CannotUnpostException;
import com.flagship.bookkeeping.exception.NothingToPostException;
import com.flagship.bookkeeping.exception.NothingToUnpostException;
import com.flagship.bookkeeping.journal.JournalEntryEntity;
import com.flagship.bookkeeping.journal.JournalEntryRepository;
import com.flagship.bookkeeping.ledger.DayBounds;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.ledger.LedgerEntryStore;
import com.flagship.bookkeeping.ledger.PostingStatus;
import com.flagship.bookkeeping.money.Money;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import com.flagship.bookkeeping.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Moves a day's ledger lines between PENDING and POSTED.
 *
 * Posting groups the day's PENDING lines into one journal entry per Detail
 * account and flips the lines to POSTED. Unposting is the exact inverse. Account
 * balances are not touched here; that is the balance application pass.
 *
 * Each call is one transaction. The guards are read at the start of it and the
 * rows involved are locked before they change, so two concurrent posts for the
 * same day end with one {@link AlreadyPostedException} (or a unique-key
 * violation on journal entries, reported the same way).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingService {

    private final LedgerEntryStore ledgerEntryStore;
    private final JournalEntryRepository journalEntryRepository;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;
    private final Clock clock;

    /**
     * Posts every PENDING ledger line dated on {@code date}.
     *
     * @throws AlreadyPostedException if lines of the day are already POSTED, the
     *         day already has journal entries, or balances have been applied on
     *         or after the day
     * @throws NothingToPostException if the day has no PENDING lines
     */
    @Transactional
    public PostingSummary postForDate(LocalDate date, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.POSTING_DATE_MDC_KEY, date.toString());
        try {
            DayBounds day = DayBounds.of(date);
            assertNotPosted(day);

            List<LedgerEntry> pending = ledgerEntryStore.lockByDayAndStatus(day, PostingStatus.PENDING);
            if (pending.isEmpty()) {
                // a concurrent post may have taken the lines while we waited on the locks
                assertNotPosted(day);
                throw new NothingToPostException(date, "ledger entries");
            }

            List<JournalGroup> groups = LedgerAggregation.groupByDetailAccount(pending, date);
            Instant postedAt = Instant.now(clock);

            List<JournalEntryEntity> journals = new ArrayList<>(groups.size());
            List<UUID> ledgerIds = new ArrayList<>(pending.size());
            for (JournalGroup group : groups) {
                journals.add(JournalEntryEntity.create(
                    group.getDetailAccountNumber(),
                    group.getGeneralAccountNumber(),
                    date,
                    group.getDebitTotal(),
                    group.getCreditTotal(),
                    group.getLineCount(),
                    postedAt,
                    actorId));
                ledgerIds.addAll(group.getLedgerEntryIds());
            }

            try {
                journalEntryRepository.saveAllAndFlush(journals);
            } catch (DataIntegrityViolationException e) {
                throw new AlreadyPostedException(date, "journal entries for this day were created concurrently");
            }

            int flipped = ledgerEntryStore.markPosted(ledgerIds, postedAt, actorId);
            if (flipped != ledgerIds.size()) {
                throw new IllegalStateException(String.format(
                    "Expected to post %d ledger entries for %s but %d changed", ledgerIds.size(), date, flipped));
            }

            Money debitTotal = LedgerAggregation.total(groups, EntryType.DEBIT);
            Money creditTotal = LedgerAggregation.total(groups, EntryType.CREDIT);
            PostingSummary summary = new PostingSummary(date, flipped, groups.size(), debitTotal, creditTotal, postedAt);
            auditTrailService.record(AuditEventType.LEDGER_POSTED, date.toString(), actorId, summary);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("post_ledger", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            metrics.recordLedgerLines("posted", flipped);
            log.info("Posted ledger: lines={}, journalEntries={}, debit={}, credit={}, duration={}ms",
                    flipped, groups.size(), debitTotal, creditTotal, duration);

            return summary;

        } catch (BookkeepingException e) {
            metrics.recordOperation("post_ledger", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Posting rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.POSTING_DATE_MDC_KEY);
        }
    }

    /**
     * Returns the day's POSTED lines to PENDING and drops the day's journal entries.
     *
     * @throws CannotUnpostException if any of the day's journal entries has had
     *         its balances applied; revert those first
     * @throws NothingToUnpostException if the day has no POSTED lines
     */
    @Transactional
    public UnpostingSummary unpostForDate(LocalDate date, String actorId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.POSTING_DATE_MDC_KEY, date.toString());
        try {
            long appliedJournals = journalEntryRepository.lockByDate(date).stream()
                .filter(j -> j.getPostingStatus() == PostingStatus.POSTED)
                .count();
            if (appliedJournals > 0) {
                throw new CannotUnpostException(date, appliedJournals);
            }

            DayBounds day = DayBounds.of(date);
            List<LedgerEntry> posted = ledgerEntryStore.lockByDayAndStatus(day, PostingStatus.POSTED);
            if (posted.isEmpty()) {
                throw new NothingToUnpostException(date, "ledger entries");
            }

            List<UUID> ids = posted.stream().map(LedgerEntry::getId).toList();
            int flipped = ledgerEntryStore.markPending(ids, actorId);
            int deletedGroups = journalEntryRepository.deleteByDateAndStatus(date, PostingStatus.PENDING);

            UnpostingSummary summary = new UnpostingSummary(date, flipped, deletedGroups, Instant.now(clock));
            auditTrailService.record(AuditEventType.LEDGER_UNPOSTED, date.toString(), actorId, summary);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation("unpost_ledger", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
            metrics.recordLedgerLines("unposted", flipped);
            log.info("Unposted ledger: lines={}, journalEntriesDeleted={}, duration={}ms",
                    flipped, deletedGroups, duration);

            return summary;

        } catch (BookkeepingException e) {
            metrics.recordOperation("unpost_ledger", BookkeepingMetrics.OUTCOME_REJECTED,
                    System.currentTimeMillis() - startTime);
            log.warn("Unposting rejected [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.POSTING_DATE_MDC_KEY);
        }
    }

    private void assertNotPosted(DayBounds day) {
        LocalDate date = day.getDate();
        if (ledgerEntryStore.existsPostedOnDay(day)) {
            throw new AlreadyPostedException(date, "ledger entries of this day are already posted");
        }
        if (journalEntryRepository.existsByLedgerDate(date)) {
            throw new AlreadyPostedException(date, "journal entries already exist for this day");
        }
        // on or after: a POSTED journal dated earlier must not block later days
        if (journalEntryRepository.existsByPostingStatusAndLedgerDateGreaterThanEqual(PostingStatus.POSTED, date)) {
            throw new AlreadyPostedException(date, "balances have already been applied on or after this day");
        }
    }
}
