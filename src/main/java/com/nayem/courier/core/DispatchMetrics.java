package com.nayem.courier.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for dispatch throughput and failures. Every method is a no-op when no
 * {@link MeterRegistry} is configured.
 */
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter publishCounter;
    private final Counter publishFailureCounter;
    private final Counter shortCircuitCounter;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        if (registry != null) {
            this.publishCounter = Counter.builder("courier.publish")
                    .description("Number of published messages")
                    .register(registry);

            this.publishFailureCounter = Counter.builder("courier.publish.failures")
                    .description("Number of handler failures during publish")
                    .register(registry);

            this.shortCircuitCounter = Counter.builder("courier.short_circuit")
                    .description("Number of invocations short-circuited by middleware")
                    .register(registry);
        } else {
            this.publishCounter = null;
            this.publishFailureCounter = null;
            this.shortCircuitCounter = null;
        }
    }

    public long startTime() {
        return registry != null ? System.nanoTime() : 0L;
    }

    public void recordInvoke(Class<?> messageType, long startNanos, boolean success) {
        if (registry != null) {
            Timer.builder("courier.invoke")
                    .description("Handler invocation duration")
                    .tag("message", messageType.getSimpleName())
                    .tag("outcome", success ? "success" : "failure")
                    .register(registry)
                    .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void recordPublish() {
        if (publishCounter != null) {
            publishCounter.increment();
        }
    }

    public void recordPublishFailures(int count) {
        if (publishFailureCounter != null && count > 0) {
            publishFailureCounter.increment(count);
        }
    }

    public void recordShortCircuit() {
        if (shortCircuitCounter != null) {
            shortCircuitCounter.increment();
        }
    }

    public static DispatchMetrics noOp() {
        return new DispatchMetrics(null);
    }
}
