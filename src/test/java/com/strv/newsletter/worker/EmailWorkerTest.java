package com.strv.newsletter.worker;

import com.strv.newsletter.mail.MailSendException;
import com.strv.newsletter.metrics.DispatchMetrics;
import com.strv.newsletter.queue.BoundedJobQueue;
import com.strv.newsletter.queue.EmailJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EmailWorkerTest {

    private ExecutorService executor;
    private BoundedJobQueue queue;
    private LifecycleContext context;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        queue = new BoundedJobQueue(10);
        context = new LifecycleContext();
        metrics = new DispatchMetrics(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testRunDrainsQueueAfterCancel() throws InterruptedException {
        RecordingMailSender sender = new RecordingMailSender();
        AtomicInteger exits = new AtomicInteger();
        EmailWorker worker = new EmailWorker(1, queue, context, sender, Duration.ofSeconds(5),
                executor, new LoggingFailedJobHandler(), metrics, exits::incrementAndGet);

        queue.put(new EmailJob("a@example.com", "A", "a", "nl-1"));
        queue.put(new EmailJob("b@example.com", "B", "b", "nl-1"));
        context.cancel();
        queue.close();

        worker.run();

        assertEquals(2, sender.getRecipients().size(), "Buffered jobs should be sent in drain mode");
        assertEquals(1, exits.get(), "Exit callback should run once");
    }

    @Test
    void testHandlerErrorDoesNotStopWorker() {
        AtomicReference<EmailJob> handled = new AtomicReference<>();
        EmailWorker worker = new EmailWorker(1, queue, context, (timeout, to, subject, body) -> {
            throw new MailSendException("nope");
        }, Duration.ofSeconds(5), executor, (job, cause) -> {
            handled.set(job);
            throw new IllegalStateException("handler broke");
        }, metrics, () -> { });

        EmailJob job = new EmailJob("a@example.com", "A", "a", "nl-1");
        assertDoesNotThrow(() -> worker.process(job), "Handler failure should be contained");
        assertEquals(job, handled.get(), "Handler should receive the failed job");
        assertEquals(1.0, metrics.getRegistry().get("newsletter.dispatch.jobs.failed").counter().count(),
                "Failure should be counted");
    }

    @Test
    void testRejectedExecutionFailsJob() {
        executor.shutdownNow();
        AtomicReference<Throwable> cause = new AtomicReference<>();
        EmailWorker worker = new EmailWorker(1, queue, context, new RecordingMailSender(), Duration.ofSeconds(5),
                executor, (job, t) -> cause.set(t), metrics, () -> { });

        worker.process(new EmailJob("a@example.com", "A", "a", "nl-1"));

        assertInstanceOf(MailSendException.class, cause.get(), "Rejected send should be reported as failure");
    }

    @Test
    void testRuntimeErrorDoesNotKillWorker() throws InterruptedException {
        DispatchMetrics broken = new DispatchMetrics(new SimpleMeterRegistry()) {
            @Override
            public void recordSent(Duration duration) {
                throw new IllegalStateException("registry closed");
            }
        };
        RecordingMailSender sender = new RecordingMailSender();
        AtomicInteger exits = new AtomicInteger();
        EmailWorker worker = new EmailWorker(1, queue, context, sender, Duration.ofSeconds(5),
                executor, new LoggingFailedJobHandler(), broken, exits::incrementAndGet);

        queue.put(new EmailJob("a@example.com", "A", "a", "nl-1"));
        queue.put(new EmailJob("b@example.com", "B", "b", "nl-1"));
        queue.close();

        worker.run();

        assertEquals(2, sender.getRecipients().size(), "Worker should keep serving after an unexpected error");
        assertEquals(1, exits.get(), "Exit callback should run once");
    }
}
