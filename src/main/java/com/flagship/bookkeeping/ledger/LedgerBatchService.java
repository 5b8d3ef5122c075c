package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.audit.AuditEventType;
import com.flagship.bookkeeping.audit.AuditTrailService;
import com.flagship.bookkeeping.exception.BatchNotFoundException;
import com.flagship.bookkeeping.exception.PendingOnlyException;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Read and delete access to whole ledger batches. Lines are never edited one by
 * one: that would break the batch balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerBatchService {

    private final LedgerEntryStore ledgerEntryStore;
    private final AuditTrailService auditTrailService;
    private final BookkeepingMetrics metrics;

    @Transactional(readOnly = true)
    public LedgerBatch findBatch(String referenceNumber) {
        return ledgerEntryStore.findBatch(referenceNumber)
            .orElseThrow(() -> new BatchNotFoundException(referenceNumber));
    }

    /**
     * Removes a batch and all of its lines, allowed only while none is POSTED.
     */
    @Transactional
    public int deletePendingBatch(String referenceNumber, String actorId) {
        long startTime = System.currentTimeMillis();

        if (!ledgerEntryStore.lockBatch(referenceNumber)) {
            throw new BatchNotFoundException(referenceNumber);
        }
        int posted = ledgerEntryStore.countPostedLines(referenceNumber);
        if (posted > 0) {
            throw new PendingOnlyException(referenceNumber, posted);
        }

        int deleted = ledgerEntryStore.deleteBatch(referenceNumber);
        auditTrailService.record(AuditEventType.BATCH_DELETED, referenceNumber, actorId,
                Map.of("referenceNumber", referenceNumber, "deletedLines", deleted));

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordOperation("delete_batch", BookkeepingMetrics.OUTCOME_SUCCESS, duration);
        log.info("Deleted pending ledger batch {}: lines={}", referenceNumber, deleted);
        return deleted;
    }
}
