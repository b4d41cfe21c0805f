package com.strv.newsletter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Email dispatch metrics.
 *
 * <p>Counters for accepted, sent, failed and timed out jobs, a send duration timer
 * <br>and gauges for queue depth and live workers.
 */
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter sent;
    private final Counter failed;
    private final Counter timeouts;
    private final Timer sendDuration;

    /**
     * Constructs a new DispatchMetrics instance backed by a private in-memory registry.
     */
    public DispatchMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Constructs a new DispatchMetrics instance.
     *
     * @param registry MeterRegistry instance.
     */
    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.enqueued = Counter.builder("newsletter.dispatch.jobs.enqueued")
                .description("Email jobs accepted into the queue")
                .register(registry);
        this.sent = Counter.builder("newsletter.dispatch.jobs.sent")
                .description("Email jobs delivered to the mail transport")
                .register(registry);
        this.failed = Counter.builder("newsletter.dispatch.jobs.failed")
                .description("Email jobs whose delivery attempt failed")
                .register(registry);
        this.timeouts = Counter.builder("newsletter.dispatch.jobs.timeouts")
                .description("Email jobs abandoned after the send timeout")
                .register(registry);
        this.sendDuration = Timer.builder("newsletter.dispatch.send.duration")
                .description("Duration of delivery attempts")
                .register(registry);
    }

    /**
     * Registers the queue depth and live worker gauges.
     *
     * @param queueSize   Queue size supplier.
     * @param liveWorkers Live worker count supplier.
     */
    public void bindPool(Supplier<Number> queueSize, Supplier<Number> liveWorkers) {
        Gauge.builder("newsletter.dispatch.queue.size", queueSize)
                .description("Email jobs waiting in the queue")
                .register(registry);
        Gauge.builder("newsletter.dispatch.workers.live", liveWorkers)
                .description("Email worker threads still running")
                .register(registry);
    }

    public void recordEnqueued() {
        enqueued.increment();
    }

    public void recordSent(Duration duration) {
        sent.increment();
        sendDuration.record(duration);
    }

    public void recordFailed(Duration duration) {
        failed.increment();
        sendDuration.record(duration);
    }

    public void recordTimeout() {
        timeouts.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
