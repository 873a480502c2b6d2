package com.flagship.ledger_invoicing.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for ledger and invoicing operations.
 *
 * Metrics exposed:
 * - ledger.entries.recorded: entries accepted, tagged by operation
 * - ledger.entries.rejected: entries refused, tagged by reason
 * - ledger.transactions.deleted: tagged by deletion policy
 * - invoice.line.mutations: line add/update/remove, tagged by operation and outcome
 * - invoice.totals.recompute.duration: latency of a header recomputation
 * - invoices.created: tagged by outcome
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Timer recomputeTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recomputeTimer = Timer.builder("invoice.totals.recompute.duration")
                .description("Time taken to recompute invoice header totals from its lines")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordEntryAccepted(String operation) {
        registry.counter("ledger.entries.recorded",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordEntryRejected(String reason) {
        registry.counter("ledger.entries.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordTransactionDeleted(String policy) {
        registry.counter("ledger.transactions.deleted",
                "policy", sanitizeTag(policy)
        ).increment();
    }

    // ==================== Invoicing ====================

    public void recordInvoiceCreated(String outcome) {
        Counter.builder("invoices.created")
                .tag("outcome", sanitizeTag(outcome))
                .register(registry)
                .increment();
    }

    public void recordLineMutation(String operation, String outcome) {
        registry.counter("invoice.line.mutations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLineMutationLatency(String operation, long durationMs) {
        registry.timer("invoice.line.mutation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timeRecompute(Supplier<T> operation) {
        return recomputeTimer.record(operation);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
