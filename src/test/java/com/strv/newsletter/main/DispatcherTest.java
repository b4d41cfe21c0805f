package com.strv.newsletter.main;

import com.strv.newsletter.config.DispatchConfig;
import com.strv.newsletter.issue.FanoutResult;
import com.strv.newsletter.issue.NewsletterIssue;
import com.strv.newsletter.issue.Subscriber;
import com.strv.newsletter.metrics.MetricsRegistry;
import com.strv.newsletter.queue.QueueClosedException;
import com.strv.newsletter.worker.PoolState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    private Dispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        MetricsRegistry.register(null);
    }

    private static DispatchConfig config(boolean metrics, long shutdownTimeoutSeconds) {
        Map<String, Object> worker = new HashMap<>();
        worker.put("count", 2.0);
        worker.put("queueCapacity", 4.0);
        worker.put("shutdownTimeoutSeconds", (double) shutdownTimeoutSeconds);

        Map<String, Object> mail = new HashMap<>();
        mail.put("provider", "console");

        Map<String, Object> metricsMap = new HashMap<>();
        metricsMap.put("enabled", metrics);
        metricsMap.put("port", 0.0);

        Map<String, Object> map = new HashMap<>();
        map.put("worker", worker);
        map.put("mail", mail);
        map.put("metrics", metricsMap);
        return new DispatchConfig(map);
    }

    @Test
    void testStartPublishShutdown() throws IOException, InterruptedException {
        dispatcher = new Dispatcher(config(false, 0));
        dispatcher.start();

        assertEquals(PoolState.RUNNING, dispatcher.getPool().getState());
        assertEquals(2, dispatcher.getPool().getWorkerCount());
        assertEquals(4, dispatcher.getPool().getQueueCapacity());
        assertNull(dispatcher.getEndpoint(), "Metrics endpoint should be disabled");

        FanoutResult result = dispatcher.getFanout().publish(
                new NewsletterIssue("nl-1", "post-1", "Hello", "<p>Hello readers</p>"),
                List.of(new Subscriber("a@example.com", "ta"),
                        new Subscriber("b@example.com", "tb"),
                        new Subscriber("c@example.com", "tc"),
                        new Subscriber("d@example.com", "td"),
                        new Subscriber("e@example.com", "te")));
        assertEquals(5, result.getEnqueued());

        assertTrue(dispatcher.shutdown(), "Shutdown without deadline should drain");
        assertTrue(dispatcher.getContext().isCancelled(), "Lifecycle should be cancelled");
        assertEquals(PoolState.STOPPED, dispatcher.getPool().getState());
        assertEquals(0, dispatcher.getPool().getQueueSize());

        assertThrows(QueueClosedException.class, () -> dispatcher.getFanout().publish(
                new NewsletterIssue("nl-1", "post-2", "Late", "<p>Late</p>"),
                List.of(new Subscriber("a@example.com", "ta"))), "Publishing after shutdown should fail");
    }

    @Test
    void testShutdownWithDeadline() throws IOException {
        dispatcher = new Dispatcher(config(false, 5));
        dispatcher.start();

        assertTrue(dispatcher.shutdown(), "Idle pool should drain within the deadline");
        assertTrue(dispatcher.shutdown(), "Repeated shutdown should be harmless");
    }

    @Test
    void testMetricsEndpointEnabled() throws IOException {
        dispatcher = new Dispatcher(config(true, 0));
        dispatcher.start();

        assertNotNull(dispatcher.getEndpoint(), "Metrics endpoint should be started");
        assertTrue(dispatcher.getEndpoint().getPort() > 0, "Endpoint should be bound");
        assertNotNull(MetricsRegistry.getPrometheusRegistry(), "Prometheus registry should be registered");
    }

    @Test
    void testShutdownBeforeStart() {
        dispatcher = new Dispatcher(config(false, 0));
        assertTrue(dispatcher.shutdown(), "Nothing to drain before start");
    }
}
