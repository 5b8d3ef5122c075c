package com.flagship.bookkeeping.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of the audit trail, written in the same transaction as the mutation it
 * describes and shipped to Kafka afterwards.
 */
@Value
public class AuditEvent {
    UUID id;
    String aggregateType;
    String aggregateKey;
    String eventType;
    String actorId;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until shipped
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static AuditEvent create(AuditEventType type, String aggregateKey, String actorId, String payload) {
        return new AuditEvent(
            UUID.randomUUID(),
            type.getAggregate().getTypeName(),
            aggregateKey,
            type.getEventName(),
            actorId,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
