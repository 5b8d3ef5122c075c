package com.flagship.bookkeeping.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Counters and timers for the engine operations.
 *
 * - bookkeeping.operations{operation, outcome}: one increment per call
 * - bookkeeping.operation.latency{operation}: wall time per call
 * - bookkeeping.ledger.lines{direction}: ledger lines accepted, posted or unposted
 */
@Component
public class BookkeepingMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public BookkeepingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome, long durationMs) {
        registry.counter("bookkeeping.operations",
                "operation", operation,
                "outcome", outcome
        ).increment();

        Timer.builder("bookkeeping.operation.latency")
                .description("Engine operation latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordLedgerLines(String direction, int count) {
        if (count <= 0) {
            return;
        }
        registry.counter("bookkeeping.ledger.lines",
                "direction", direction
        ).increment(count);
    }
}
