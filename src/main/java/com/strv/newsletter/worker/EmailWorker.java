package com.strv.newsletter.worker;

import com.strv.newsletter.mail.MailSendException;
import com.strv.newsletter.mail.MailSender;
import com.strv.newsletter.metrics.DispatchMetrics;
import com.strv.newsletter.queue.BoundedJobQueue;
import com.strv.newsletter.queue.EmailJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Email worker loop.
 *
 * <p>Takes jobs from the shared queue and hands each one to the mail sender until the queue
 * <br>is closed and empty. Once the lifecycle is cancelled the worker keeps going in drain mode
 * <br>so that every job accepted before shutdown still gets its delivery attempt.
 *
 * <p>Each send runs on the send executor and is bounded by the per job timeout, independent of
 * <br>the lifecycle. A send that outlives the timeout is interrupted and abandoned, and the
 * <br>worker moves on to the next job.
 *
 * <p>Failures are logged, counted and passed to the {@link FailedJobHandler}. They are never requeued.
 */
class EmailWorker implements Runnable {
    private static final Logger log = LogManager.getLogger(EmailWorker.class);

    private final int id;
    private final BoundedJobQueue queue;
    private final LifecycleContext context;
    private final MailSender sender;
    private final Duration sendTimeout;
    private final ExecutorService sendExecutor;
    private final FailedJobHandler failedJobHandler;
    private final DispatchMetrics metrics;
    private final Runnable onExit;

    /**
     * Constructs a new EmailWorker instance.
     *
     * @param id               Worker id for logging.
     * @param queue            Shared job queue.
     * @param context          Lifecycle context.
     * @param sender           Mail sender.
     * @param sendTimeout      Per job timeout.
     * @param sendExecutor     Executor running the sends.
     * @param failedJobHandler Failure sink.
     * @param metrics          Dispatch metrics.
     * @param onExit           Called once when the loop ends.
     */
    EmailWorker(int id, BoundedJobQueue queue, LifecycleContext context, MailSender sender, Duration sendTimeout,
                ExecutorService sendExecutor, FailedJobHandler failedJobHandler, DispatchMetrics metrics, Runnable onExit) {
        this.id = id;
        this.queue = queue;
        this.context = context;
        this.sender = sender;
        this.sendTimeout = sendTimeout;
        this.sendExecutor = sendExecutor;
        this.failedJobHandler = failedJobHandler;
        this.metrics = metrics;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        log.info("Email worker {} started", id);
        boolean draining = false;
        try {
            while (true) {
                if (!draining && context.isCancelled()) {
                    draining = true;
                    log.info("Email worker {}: lifecycle cancelled, draining remaining jobs", id);
                }

                Optional<EmailJob> job = queue.take();
                if (job.isEmpty()) {
                    log.info("Email worker {}: job queue closed and drained, exiting", id);
                    return;
                }
                try {
                    process(job.get());
                } catch (RuntimeException e) {
                    log.error("Email worker {}: unexpected error processing job: to={}, newsletterId={}, error={}",
                            id, job.get().getTo(), job.get().getNewsletterId(), e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Email worker {} interrupted, exiting with {} jobs queued", id, queue.size());
        } catch (Error e) {
            log.error("Email worker {} died: {}", id, e.getMessage(), e);
            throw e;
        } finally {
            onExit.run();
        }
    }

    /**
     * Attempts delivery of one job within the send timeout.
     *
     * @param job EmailJob instance.
     */
    void process(EmailJob job) {
        log.debug("Worker {}: processing email job: newsletterId={}, to={}, subject={}",
                id, job.getNewsletterId(), job.getTo(), job.getSubject());

        long start = System.nanoTime();
        Future<?> future;
        try {
            future = sendExecutor.submit(() -> {
                sender.send(sendTimeout, job.getTo(), job.getSubject(), job.getBody());
                return null;
            });
        } catch (RejectedExecutionException e) {
            fail(job, new MailSendException("Send executor full, abandoned sends still hold its threads", e), elapsed(start));
            return;
        }

        try {
            future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration duration = elapsed(start);
            metrics.recordSent(duration);
            log.info("Worker {}: email sent: to={}, newsletterId={}, subject={}, durationMs={}",
                    id, job.getTo(), job.getNewsletterId(), job.getSubject(), duration.toMillis());
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordTimeout();
            fail(job, new MailSendException("Send timed out after " + sendTimeout.toMillis() + "ms", e), elapsed(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(job, cause, elapsed(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            fail(job, new MailSendException("Worker interrupted during send", e), elapsed(start));
        }
    }

    /**
     * Logs, counts and hands over a failed job.
     *
     * @param job      Failed job.
     * @param cause    Cause.
     * @param duration Attempt duration.
     */
    private void fail(EmailJob job, Throwable cause, Duration duration) {
        metrics.recordFailed(duration);
        log.error("Worker {}: failed to send email: to={}, newsletterId={}, subject={}, durationMs={}, error={}",
                id, job.getTo(), job.getNewsletterId(), job.getSubject(), duration.toMillis(), cause.getMessage());

        try {
            failedJobHandler.onFailure(job, cause);
        } catch (RuntimeException e) {
            log.error("Worker {}: failed job handler error: {}", id, e.getMessage(), e);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
