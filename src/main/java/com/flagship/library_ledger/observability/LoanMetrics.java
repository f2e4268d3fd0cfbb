package com.flagship.library_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Counters and timers for loan operations.
 *
 * Metrics exposed:
 * - library.loans.created: loans created, tagged by outcome
 * - library.loans.returned: loans returned, tagged by outcome
 * - library.loan.operation.duration: latency per operation
 *
 * The outcome tag is {@code success} or the lowercase error code, so rejected
 * requests (out_of_stock, already_returned, ...) can be told apart.
 */
@Component
public class LoanMetrics {

    private final MeterRegistry registry;

    public LoanMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLoanCreated(String outcome) {
        registry.counter("library.loans.created", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLoanReturned(String outcome) {
        registry.counter("library.loans.returned", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("library.loan.operation.duration")
                .description("Time taken by loan ledger operations")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
