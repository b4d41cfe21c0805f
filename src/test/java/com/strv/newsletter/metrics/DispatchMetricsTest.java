package com.strv.newsletter.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DispatchMetricsTest {

    @Test
    void testCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DispatchMetrics metrics = new DispatchMetrics(registry);

        metrics.recordEnqueued();
        metrics.recordEnqueued();
        metrics.recordSent(Duration.ofMillis(40));
        metrics.recordFailed(Duration.ofMillis(60));
        metrics.recordTimeout();

        assertEquals(2.0, registry.get("newsletter.dispatch.jobs.enqueued").counter().count());
        assertEquals(1.0, registry.get("newsletter.dispatch.jobs.sent").counter().count());
        assertEquals(1.0, registry.get("newsletter.dispatch.jobs.failed").counter().count());
        assertEquals(1.0, registry.get("newsletter.dispatch.jobs.timeouts").counter().count());
        assertEquals(2L, registry.get("newsletter.dispatch.send.duration").timer().count(), "Both attempts should be timed");
        assertEquals(100.0, registry.get("newsletter.dispatch.send.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void testGauges() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DispatchMetrics metrics = new DispatchMetrics(registry);
        AtomicInteger queueSize = new AtomicInteger(3);
        AtomicInteger live = new AtomicInteger(5);

        metrics.bindPool(queueSize::get, live::get);
        queueSize.set(7);
        live.set(4);

        assertEquals(7.0, registry.get("newsletter.dispatch.queue.size").gauge().value());
        assertEquals(4.0, registry.get("newsletter.dispatch.workers.live").gauge().value());
    }
}
