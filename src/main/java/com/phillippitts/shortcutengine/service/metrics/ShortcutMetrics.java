package com.phillippitts.shortcutengine.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for shortcut dispatch.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Trigger counts per shortcut and source (keyboard, manual)</li>
 *   <li>Handler failures per shortcut</li>
 *   <li>Time spent in a shortcut's handlers</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ShortcutMetrics {

    static final String METRIC_PREFIX = "shortcuts";

    private final MeterRegistry registry;

    public ShortcutMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the trigger counter.
     *
     * @param shortcutId triggered shortcut
     * @param source what fired it (keyboard, manual)
     */
    public void incrementTrigger(String shortcutId, String source) {
        Counter.builder(METRIC_PREFIX + ".trigger")
                .description("Number of shortcut triggers")
                .tag("id", shortcutId)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Adds handler failures for a shortcut.
     *
     * @param shortcutId shortcut whose handlers threw
     * @param count number of failed handlers (no-op when zero)
     */
    public void incrementHandlerFailures(String shortcutId, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".handler.failure")
                .description("Number of shortcut handlers that threw")
                .tag("id", shortcutId)
                .register(registry)
                .increment(count);
    }

    /**
     * Records the time spent running a shortcut's handlers.
     *
     * @param shortcutId dispatched shortcut
     * @param durationNanos duration in nanoseconds
     */
    public void recordHandlerLatency(String shortcutId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".handler.latency")
                .description("Time spent in shortcut handlers")
                .tag("id", shortcutId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
