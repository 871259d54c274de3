package com.flagship.bank_account.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for account operations.
 *
 * Metrics exposed:
 * - account.operations: Counter tagged with operation and outcome
 * - account.operation.latency: Timer tagged with operation
 */
@Component
public class AccountMetrics {

    public static final String OPERATIONS_COUNTER = "account.operations";
    public static final String LATENCY_TIMER = "account.operation.latency";

    private final MeterRegistry registry;

    public AccountMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of an operation, e.g. ("deposit", "success")
     * or ("withdraw", "insufficient_funds").
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter(OPERATIONS_COUNTER,
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer(LATENCY_TIMER,
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
