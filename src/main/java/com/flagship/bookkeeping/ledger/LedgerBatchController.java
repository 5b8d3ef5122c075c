package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.ledger.dto.BatchReceiptResponse;
import com.flagship.bookkeeping.ledger.dto.LedgerBatchResponse;
import com.flagship.bookkeeping.ledger.dto.SubmitBatchRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Ledger batch intake. A batch is accepted whole or rejected whole; lines
 * enter PENDING and stay editable only by deleting the batch.
 */
@RestController
@RequestMapping("/api/ledgers/batches")
@RequiredArgsConstructor
@Slf4j
public class LedgerBatchController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final LedgerIntakeService intakeService;
    private final LedgerBatchService batchService;

    @PostMapping
    public ResponseEntity<BatchReceiptResponse> submitBatch(@Valid @RequestBody SubmitBatchRequest request,
                                                            @RequestHeader(ACTOR_HEADER) String actorId) {
        log.info("Received ledger batch: lines={}", request.getLines().size());
        BatchReceipt receipt = intakeService.submitBatch(request.toBatchRequest(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchReceiptResponse.from(receipt));
    }

    @GetMapping("/{referenceNumber}")
    public LedgerBatchResponse getBatch(@PathVariable("referenceNumber") String referenceNumber) {
        return LedgerBatchResponse.from(batchService.findBatch(referenceNumber));
    }

    @DeleteMapping("/{referenceNumber}")
    public Map<String, Object> deleteBatch(@PathVariable("referenceNumber") String referenceNumber,
                                           @RequestHeader(ACTOR_HEADER) String actorId) {
        int deleted = batchService.deletePendingBatch(referenceNumber, actorId);
        return Map.of("reference_number", referenceNumber, "deleted_lines", deleted);
    }
}
