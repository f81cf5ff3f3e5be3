package com.phillippitts.modeestimator.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for mode estimates.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Estimate latency per operation (first, all, single)</li>
 *   <li>Determined/undetermined outcomes per operation</li>
 *   <li>Rejected requests per reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ModeMetrics {

    private static final String METRIC_PREFIX = "modeestimator";

    private final MeterRegistry registry;

    public ModeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records estimate latency for an operation.
     *
     * @param operation operation tag (first, all, single)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".estimate.latency")
                .description("Time taken to estimate the mode")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts an estimate by operation and whether it committed to a value.
     *
     * @param operation operation tag (first, all, single)
     * @param determined false when the result was unknown
     */
    public void recordOutcome(String operation, boolean determined) {
        Counter.builder(METRIC_PREFIX + ".estimate")
                .description("Number of mode estimates by outcome")
                .tag("operation", operation)
                .tag("outcome", determined ? "determined" : "undetermined")
                .register(registry)
                .increment();
    }

    /**
     * Counts a rejected request.
     *
     * @param reason rejection reason (contract_violation, too_large)
     */
    public void incrementRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Number of rejected estimate requests")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
