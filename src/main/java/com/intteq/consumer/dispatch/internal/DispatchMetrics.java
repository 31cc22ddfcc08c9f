package com.intteq.consumer.dispatch.internal;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.Nullable;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters recorded by the dispatchers. Every method is a no-op without a registry.
 */
public class DispatchMetrics {

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    public DispatchMetrics(@Nullable MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public static DispatchMetrics noop() {
        return new DispatchMetrics(null);
    }

    public void recordSuccess(String queue, long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer("dispatch.consume.latency", "queue", queue)
                .record(durationNs, TimeUnit.NANOSECONDS);
        meterRegistry.counter("dispatch.consume.success", "queue", queue).increment();
    }

    public void recordFailure(String queue, boolean causedByHandler) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "dispatch.consume.failure",
                        "queue", queue,
                        "cause", causedByHandler ? "handler" : "dispatch")
                .increment();
    }

    public void recordPublish(String queue) {
        if (meterRegistry == null) return;
        meterRegistry.counter("dispatch.publish.success", "queue", queue).increment();
    }
}
