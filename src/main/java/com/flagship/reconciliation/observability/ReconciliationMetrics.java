package com.flagship.reconciliation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for reconciliation runs.
 *
 * Metrics exposed:
 * - reconciliation.outcome: Counter of per-record outcomes, tagged by outcome
 * - reconciliation.link.applied: Counter of links written, tagged by kind and strategy
 * - reconciliation.link.already_satisfied: Counter of idempotent re-applies
 * - reconciliation.link.unlinked: Counter of guarded unlinks
 * - reconciliation.snapshot.rows: Counter of rows copied into snapshots, tagged by table
 * - reconciliation.guard.operation: Counter of guarded operations, tagged by kind and outcome
 * - reconciliation.balance.recalculated: Counter of aggregate balance rewrites
 * - reconciliation.balance.drifted: Counter of aggregates found with a stale cached balance
 * - reconciliation.record.duration: Timer for evaluating (and applying) one record
 * - reconciliation.run.duration: Timer for a whole run
 */
@Component
public class ReconciliationMetrics {

    private final MeterRegistry registry;

    private final Counter alreadySatisfied;
    private final Counter unlinks;
    private final Counter balancesRecalculated;

    private final Timer recordTimer;
    private final Timer runTimer;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.alreadySatisfied = Counter.builder("reconciliation.link.already_satisfied")
                .description("Number of link applies that found an identical link in place")
                .register(registry);

        this.unlinks = Counter.builder("reconciliation.link.unlinked")
                .description("Number of links removed through a guarded unlink")
                .register(registry);

        this.balancesRecalculated = Counter.builder("reconciliation.balance.recalculated")
                .description("Number of aggregate balance recalculations")
                .register(registry);

        this.recordTimer = Timer.builder("reconciliation.record.duration")
                .description("Time taken to evaluate and apply one record")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.runTimer = Timer.builder("reconciliation.run.duration")
                .description("Time taken by a whole reconciliation run")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void recordOutcome(String outcome) {
        registry.counter("reconciliation.outcome", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLinkApplied(String kind, String strategy) {
        registry.counter("reconciliation.link.applied",
                "kind", sanitizeTag(kind),
                "strategy", sanitizeTag(strategy)
        ).increment();
    }

    public void incrementAlreadySatisfied() {
        alreadySatisfied.increment();
    }

    public void incrementUnlinks() {
        unlinks.increment();
    }

    public void incrementBalancesRecalculated() {
        balancesRecalculated.increment();
    }

    public void recordBalanceDrift(int driftedAggregates) {
        registry.counter("reconciliation.balance.drifted").increment(driftedAggregates);
    }

    public void recordSnapshot(String table, int rows) {
        registry.counter("reconciliation.snapshot.rows", "table", sanitizeTag(table)).increment(rows);
    }

    /**
     * Records a guarded operation by kind and result (APPLIED, FAILED, WRITE_MODE_REQUIRED, ...).
     */
    public void recordGuardedOperation(String kind, String result) {
        registry.counter("reconciliation.guard.operation",
                "kind", sanitizeTag(kind),
                "result", sanitizeTag(result)
        ).increment();
    }

    // ==================== Timer Methods ====================

    public void recordRecordDuration(Duration duration) {
        recordTimer.record(duration);
    }

    public <T> T timeRun(Supplier<T> run) {
        return runTimer.record(run);
    }

    // ==================== Helper Methods ====================

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
