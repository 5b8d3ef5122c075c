package com.flagship.bookkeeping.observability;

import com.flagship.bookkeeping.audit.AuditEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Audit trail backlog gauges and publish counters.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler} so a scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditMetrics {

    private final AuditEventRepository auditEventRepository;
    private final MeterRegistry meterRegistry;

    @Value("${audit.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("audit.backlog.size", backlogSize, AtomicLong::get)
                .description("Audit events not yet shipped to Kafka")
                .register(meterRegistry);

        Gauge.builder("audit.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unshipped audit event in seconds")
                .register(meterRegistry);

        Gauge.builder("audit.events.dead_letter", deadLetterCount, AtomicLong::get)
                .description("Audit events that exhausted their retries")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = auditEventRepository.countUnpublished();
            backlogSize.set(unpublished);

            auditEventRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            deadLetterCount.set(auditEventRepository.countDeadLetters(maxRetries));

            log.debug("Audit metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                    unpublished, oldestEventAgeSeconds.get(), deadLetterCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh audit metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public long getDeadLetterCount() {
        return deadLetterCount.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("audit.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("audit.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("audit.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
