package com.phillippitts.speakdict.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for user dictionary maintenance.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recompilation latency</li>
 *   <li>Recompilation success/failure counts, failures tagged by reason</li>
 *   <li>Word mutations by operation (add, update, delete, import)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DictionaryMetrics {

    private static final String METRIC_PREFIX = "speakdict";

    private final MeterRegistry registry;

    public DictionaryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall time of one recompilation.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordCompileLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".compile.latency")
                .description("Time taken to recompile the user dictionary")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCompileSuccess() {
        Counter.builder(METRIC_PREFIX + ".compile.success")
                .description("Number of successful user dictionary recompilations")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (compiler, io, store, error)
     */
    public void incrementCompileFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".compile.failure")
                .description("Number of failed user dictionary recompilations")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param op mutation kind (add, update, delete, import)
     */
    public void incrementMutation(String op) {
        Counter.builder(METRIC_PREFIX + ".words.mutation")
                .description("Number of committed user dictionary mutations")
                .tag("op", op)
                .register(registry)
                .increment();
    }
}
