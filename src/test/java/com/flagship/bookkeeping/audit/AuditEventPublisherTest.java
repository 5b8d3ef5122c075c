package com.flagship.bookkeeping.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.account.AccountCategory;
import com.flagship.bookkeeping.ledger.BatchLine;
import com.flagship.bookkeeping.ledger.BatchReceipt;
import com.flagship.bookkeeping.observability.AuditMetrics;
import com.flagship.bookkeeping.support.IntegrationTestSupport;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Audit events are written with the mutation and shipped afterwards.
 *
 * The scheduled publisher is off in tests; a publisher wired to a mocked
 * KafkaTemplate is driven by hand instead.
 */
@SpringBootTest(properties = IntegrationTestSupport.TEST_PROPERTIES)
class AuditEventPublisherTest extends IntegrationTestSupport {

    private static final String TOPIC = "bookkeeping.audit.test";
    private static final LocalDateTime DAY = LocalDateTime.of(2025, 6, 2, 14, 0);

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private AuditMetrics auditMetrics;

    @Autowired
    private ObjectMapper objectMapper;

    private KafkaTemplate<String, String> kafkaTemplate;
    private AuditEventPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        resetDatabase();
        createGeneral("11", AccountCategory.ASSET);
        createGeneral("41", AccountCategory.REVENUE);
        createDetail("1101", "11", AccountCategory.ASSET);
        createDetail("4101", "41", AccountCategory.REVENUE);

        kafkaTemplate = mock(KafkaTemplate.class);
        publisher = new AuditEventPublisher(auditTrailService, kafkaTemplate, auditMetrics);
        ReflectionTestUtils.setField(publisher, "auditTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 2);
    }

    private BatchReceipt submitSale() {
        return submit(
                BatchLine.debit("1101", "11", "12.34", DAY),
                BatchLine.credit("4101", "41", "12.34", DAY));
    }

    private static CompletableFuture<SendResult<String, String>> sent(String key, String value) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, key, value);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("A submitted batch leaves one event enveloped with actor and data")
    void testEventWrittenWithMutation() throws Exception {
        printTestHeader("Audit Event Written");

        BatchReceipt receipt = submitSale();

        List<AuditEvent> events = auditTrailService.eventsOfType(AuditEventType.BATCH_SUBMITTED);
        assertEquals(1, events.size());
        AuditEvent event = events.get(0);
        printOutput("Payload", event.getPayload());
        assertEquals("LedgerBatch", event.getAggregateType());
        assertEquals(receipt.getReferenceNumber(), event.getAggregateKey());
        assertEquals(ACTOR, event.getActorId());
        assertFalse(event.isPublished());
        assertNotNull(event.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals("LedgerBatchSubmitted", payload.get("eventType").asText());
        assertEquals(ACTOR, payload.get("actorId").asText());
        assertEquals("12.34", payload.get("data").get("debitTotal").asText());
    }

    @Test
    @DisplayName("A rejected batch leaves no event behind")
    void testRejectedMutationLeavesNoEvent() {
        assertThrows(RuntimeException.class, () -> submit(
                BatchLine.debit("1101", "11", "12.34", DAY),
                BatchLine.credit("4101", "41", "12.00", DAY)));

        assertTrue(auditTrailService.eventsOfType(AuditEventType.BATCH_SUBMITTED).isEmpty());
    }

    @Test
    @DisplayName("Published events are keyed by aggregate and marked as shipped")
    void testPublishMarksEvents() {
        printTestHeader("Publish Audit Events");
        BatchReceipt receipt = submitSale();
        long pending = auditTrailService.countUnpublished();
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenAnswer(inv -> sent(inv.getArgument(1), inv.getArgument(2)));

        publisher.triggerPublish();

        printOutput("Shipped", pending);
        verify(kafkaTemplate, times((int) pending)).send(eq(TOPIC), anyString(), anyString());
        verify(kafkaTemplate).send(eq(TOPIC), eq(receipt.getReferenceNumber()), anyString());
        assertEquals(0, auditTrailService.countUnpublished());
        assertTrue(auditEventRepository.findAll().stream().allMatch(e -> e.getPublishedAt() != null));
        printSuccess("All events shipped");
    }

    @Test
    @DisplayName("Failed sends are retried until the limit, then left as dead letters")
    void testFailuresBecomeDeadLetters() {
        printTestHeader("Dead Letter");
        submitSale();
        long pending = auditTrailService.countUnpublished();
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();
        publisher.triggerPublish();

        verify(kafkaTemplate, times((int) pending * 2)).send(eq(TOPIC), anyString(), anyString());
        assertTrue(auditEventRepository.findAll().stream()
                .allMatch(e -> e.getRetryCount() == 2 && e.getLastError().contains("broker down")));
        assertEquals(pending, auditEventRepository.countDeadLetters(2));

        // past the limit nothing is picked up any more
        publisher.triggerPublish();
        verify(kafkaTemplate, times((int) pending * 2)).send(eq(TOPIC), anyString(), anyString());
        assertEquals(pending, auditTrailService.countUnpublished());
    }

    @Test
    @DisplayName("Nothing pending means nothing sent")
    void testNothingToPublish() {
        resetDatabase();

        publisher.triggerPublish();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
