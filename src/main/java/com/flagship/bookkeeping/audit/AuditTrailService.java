package com.flagship.bookkeeping.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit events inside the caller's transaction and serves the publisher.
 *
 * If the engine operation commits, its audit row commits with it; if it rolls
 * back, no trace is left. Shipping to Kafka is the job of {@link AuditEventPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    private final AuditEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Records an event in the current transaction.
     *
     * @param payload serialized to JSON under {@code data}, next to the
     *                correlation id of the request that caused it
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(AuditEventType type, String aggregateKey, String actorId, Object payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("eventType", type.getEventName());
        envelope.put("aggregateKey", aggregateKey);
        envelope.put("actorId", actorId);
        envelope.put("correlationId", CorrelationContext.getCorrelationId());
        envelope.put("occurredAt", Instant.now());
        envelope.put("data", payload);

        AuditEvent event = AuditEvent.create(type, aggregateKey, actorId, serializePayload(envelope));
        AuditEventEntity saved = repository.save(AuditEventEntity.fromDomain(event));

        log.debug("Recorded audit event: type={}, aggregateKey={}, actor={}",
                type.getEventName(), aggregateKey, actorId);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<AuditEvent> findPublishable(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(AuditEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked audit event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Audit event {} failed to publish (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> eventsFor(AuditAggregate aggregate, String aggregateKey) {
        return repository.findByAggregateTypeAndAggregateKeyOrderBySequenceNumberAsc(
                aggregate.getTypeName(), aggregateKey)
                .stream()
                .map(AuditEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> eventsOfType(AuditEventType type) {
        return repository.findByEventTypeOrderBySequenceNumberAsc(type.getEventName())
                .stream()
                .map(AuditEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit payload", e);
        }
    }
}
