package com.flagship.agreement_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter per operation and outcome
 *   (success, an error kind such as invoice_expired, or fault)
 * - ledger.operation.latency: timer per operation
 * - ledger.transitions: counter per entity and resulting status
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome, Duration duration) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordTransition(String entity, String status) {
        registry.counter("ledger.transitions",
                "entity", sanitizeTag(entity),
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
