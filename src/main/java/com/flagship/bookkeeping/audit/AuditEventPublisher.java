package com.flagship.bookkeeping.audit;

import com.flagship.bookkeeping.observability.AuditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ships committed audit events to Kafka.
 *
 * Polls with {@code FOR UPDATE SKIP LOCKED} so several instances can run side by
 * side. Sends are synchronous and keyed by aggregate key, which keeps the events
 * of one batch, day or period in order on a single partition. Events that reach
 * the retry limit stay in the table as dead letters.
 */
@Component
@ConditionalOnProperty(name = "audit.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AuditEventPublisher {

    private final AuditTrailService auditTrailService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AuditMetrics auditMetrics;

    @Value("${kafka.topic.bookkeeping-audit:bookkeeping.audit}")
    private String auditTopic;

    @Value("${audit.publisher.batch-size:100}")
    private int batchSize;

    @Value("${audit.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${audit.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<AuditEvent> events = auditTrailService.findPublishable(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished audit events", events.size());

            for (AuditEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in audit publisher polling loop", e);
        }
    }

    private void publishEvent(AuditEvent event) {
        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(auditTopic, event.getAggregateKey(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published audit event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            auditTrailService.markPublished(event.getId());
            auditMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handleFailure(event, e);
        } catch (Exception e) {
            handleFailure(event, e);
        }
    }

    private void handleFailure(AuditEvent event, Exception e) {
        log.error("Failed to publish audit event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
        auditTrailService.markFailed(event.getId(), e.getMessage());
        auditMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Audit event {} reached max retries ({}), left as dead letter. eventType={}, aggregateKey={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateKey());
            auditMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    /**
     * Runs one polling pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
