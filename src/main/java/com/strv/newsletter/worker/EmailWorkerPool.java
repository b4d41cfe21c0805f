package com.strv.newsletter.worker;

import com.strv.newsletter.mail.MailSender;
import com.strv.newsletter.metrics.DispatchMetrics;
import com.strv.newsletter.queue.BoundedJobQueue;
import com.strv.newsletter.queue.EmailJob;
import com.strv.newsletter.queue.EmailJobQueuer;
import com.strv.newsletter.queue.QueueClosedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Email worker pool.
 *
 * <p>Owns the bounded job queue and a fixed set of worker threads draining it.
 * <br>Producers call {@link #enqueue(EmailJob)}, which blocks while the queue is full.
 * <br>Delivery is fire and forget, results are only logged and counted.
 *
 * <p>Lifecycle: {@link PoolState#CREATED} to {@link PoolState#RUNNING} on {@link #start(LifecycleContext, int)},
 * <br>then {@link PoolState#DRAINING} and {@link PoolState#STOPPED} on shutdown.
 *
 * <p>Shutdown is triggered either by cancelling the lifecycle context given to start, which a
 * <br>supervisor thread watches, or by calling {@link #stop()}. Both paths run the same
 * <br>close-and-drain sequence exactly once behind a one-shot guard, and every caller of stop
 * <br>waits for the drain to finish.
 *
 * <p>Jobs accepted before shutdown began are all handed to the mail sender before the pool stops.
 * <br>Failed sends are not retried.
 *
 * <p>Sends run on a send executor capped at {@link #SEND_THREADS_PER_WORKER} threads per worker.
 * <br>A send abandoned after its timeout keeps its thread until the sender returns, so a stalled
 * <br>transport can fill the cap. Jobs reaching a full executor fail straight away.
 */
public class EmailWorkerPool implements EmailJobQueuer {
    private static final Logger log = LogManager.getLogger(EmailWorkerPool.class);

    /**
     * Worker count used when a zero or negative value is given.
     */
    public static final int DEFAULT_WORKER_COUNT = 5;

    /**
     * Send timeout used when none or a non positive one is given.
     */
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Send threads allowed per worker, room for one abandoned send beside the current one.
     */
    public static final int SEND_THREADS_PER_WORKER = 2;

    private final MailSender sender;
    private final BoundedJobQueue queue;
    private final Duration sendTimeout;
    private final FailedJobHandler failedJobHandler;
    private final DispatchMetrics metrics;

    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.CREATED);
    private final AtomicBoolean shutdownInitiated = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicInteger liveWorkers = new AtomicInteger(0);

    // Live workers plus one token held by start() until every worker is spawned.
    private final AtomicInteger pending = new AtomicInteger(0);

    private volatile int workerCount = 0;
    private volatile ExecutorService sendExecutor;
    private volatile Thread supervisor;
    private volatile LifecycleContext lifecycle;

    /**
     * Constructs a new EmailWorkerPool instance with default timeout, logging failure handler and private metrics.
     *
     * @param sender        Mail sender.
     * @param queueCapacity Queue capacity, zero or negative selects the default.
     */
    public EmailWorkerPool(MailSender sender, int queueCapacity) {
        this(sender, queueCapacity, DEFAULT_SEND_TIMEOUT, new LoggingFailedJobHandler(), new DispatchMetrics());
    }

    /**
     * Constructs a new EmailWorkerPool instance.
     *
     * @param sender           Mail sender.
     * @param queueCapacity    Queue capacity, zero or negative selects the default.
     * @param sendTimeout      Per job timeout, null or non positive selects the default.
     * @param failedJobHandler Failure sink.
     * @param metrics          Dispatch metrics.
     */
    public EmailWorkerPool(MailSender sender, int queueCapacity, Duration sendTimeout,
                           FailedJobHandler failedJobHandler, DispatchMetrics metrics) {
        if (sender == null) {
            throw new IllegalArgumentException("mail sender is required");
        }
        if (sendTimeout == null || sendTimeout.isZero() || sendTimeout.isNegative()) {
            log.warn("Invalid send timeout {}, using default {}", sendTimeout, DEFAULT_SEND_TIMEOUT);
            sendTimeout = DEFAULT_SEND_TIMEOUT;
        }
        this.sender = sender;
        this.queue = new BoundedJobQueue(queueCapacity);
        this.sendTimeout = sendTimeout;
        this.failedJobHandler = failedJobHandler != null ? failedJobHandler : new LoggingFailedJobHandler();
        this.metrics = metrics != null ? metrics : new DispatchMetrics();
        this.metrics.bindPool(this::getQueueSize, this::getLiveWorkers);
    }

    /**
     * Starts the workers and the lifecycle supervisor.
     *
     * @param context     Lifecycle context, cancelling it shuts the pool down.
     * @param workerCount Number of workers, zero or negative selects {@link #DEFAULT_WORKER_COUNT}.
     * @throws IllegalStateException If the pool was already started or stopped, or threads cannot be created.
     */
    public void start(LifecycleContext context, int workerCount) {
        if (context == null) {
            throw new IllegalArgumentException("lifecycle context is required");
        }
        if (!state.compareAndSet(PoolState.CREATED, PoolState.RUNNING)) {
            throw new IllegalStateException("Email worker pool cannot start from state " + state.get());
        }
        if (workerCount <= 0) {
            log.warn("Invalid worker count {}, using default {}", workerCount, DEFAULT_WORKER_COUNT);
            workerCount = DEFAULT_WORKER_COUNT;
        }
        this.workerCount = workerCount;
        this.lifecycle = context;

        log.info("Starting email worker pool: workers={}, queueCapacity={}, sendTimeoutMs={}",
                workerCount, queue.capacity(), sendTimeout.toMillis());

        AtomicInteger sendThreads = new AtomicInteger(0);
        sendExecutor = new ThreadPoolExecutor(0, workerCount * SEND_THREADS_PER_WORKER,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread thread = new Thread(r, "email-send-" + sendThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        pending.set(workerCount + 1);
        int spawned = 0;
        try {
            for (int i = 0; i < workerCount; i++) {
                EmailWorker worker = new EmailWorker(i + 1, queue, context, sender, sendTimeout,
                        sendExecutor, failedJobHandler, metrics, this::onWorkerExit);
                Thread thread = new Thread(worker, "email-worker-" + (i + 1));
                liveWorkers.incrementAndGet();
                try {
                    thread.start();
                } catch (RuntimeException | OutOfMemoryError e) {
                    liveWorkers.decrementAndGet();
                    throw e;
                }
                spawned++;
            }

            supervisor = new Thread(() -> supervise(context), "email-worker-supervisor");
            supervisor.setDaemon(true);
            supervisor.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            log.error("Unable to start email workers: spawned={}, requested={}, error={}", spawned, workerCount, e.getMessage());
            shutdownInitiated.set(true);
            state.set(PoolState.DRAINING);
            queue.close();
            // Release the start token and the slots of workers that never ran, started ones exit once drained.
            releasePending(workerCount - spawned + 1);
            throw new IllegalStateException("Unable to start email worker pool", e);
        }

        releasePending(1);
    }

    /**
     * Waits for the lifecycle context to be cancelled and then stops the pool.
     *
     * @param context Lifecycle context.
     */
    private void supervise(LifecycleContext context) {
        try {
            context.await();
        } catch (InterruptedException e) {
            log.debug("Email worker supervisor released without cancellation");
            Thread.currentThread().interrupt();
            return;
        }

        log.info("Lifecycle context cancelled, initiating email worker shutdown");
        stop();
    }

    /**
     * Submits a job, blocking while the queue is full.
     *
     * @param job EmailJob instance.
     * @throws QueueClosedException If the pool is shutting down or stopped.
     * @throws InterruptedException If interrupted while waiting for space.
     */
    @Override
    public void enqueue(EmailJob job) throws InterruptedException {
        if (shutdownInitiated.get()) {
            throw new QueueClosedException("Email worker pool is shutting down");
        }

        try {
            queue.put(job);
        } catch (QueueClosedException e) {
            throw new QueueClosedException("Email worker pool is shutting down");
        }

        metrics.recordEnqueued();
        log.info("Enqueued email job: to={}, subject={}, newsletterId={}, queueSize={}",
                job.getTo(), job.getSubject(), job.getNewsletterId(), queue.size());
    }

    /**
     * Stops accepting jobs and waits until every worker has drained the queue and exited.
     * <p>Safe to call any number of times and from any thread, including concurrently with
     * <br>lifecycle cancellation. Has no deadline.
     */
    public void stop() {
        initiateShutdown();
        if (stopped.getCount() == 0) {
            return;
        }
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for email workers, drain continues in background: liveWorkers={}, queueSize={}",
                    getLiveWorkers(), queue.size());
        }
    }

    /**
     * Stops accepting jobs and waits up to the deadline for the drain.
     * <p>Workers still busy at the deadline keep draining in the background.
     *
     * @param deadline Maximum time to wait.
     * @return True if the pool reached {@link PoolState#STOPPED} within the deadline.
     * @throws InterruptedException If interrupted while waiting.
     */
    public boolean stop(Duration deadline) throws InterruptedException {
        initiateShutdown();
        boolean done = stopped.await(deadline.toMillis(), TimeUnit.MILLISECONDS);
        if (!done) {
            log.warn("Email workers did not drain within {}ms: liveWorkers={}, queueSize={}",
                    deadline.toMillis(), getLiveWorkers(), queue.size());
        }
        return done;
    }

    /**
     * Runs the close sequence exactly once.
     */
    private void initiateShutdown() {
        if (!shutdownInitiated.compareAndSet(false, true)) {
            log.debug("Email worker pool shutdown already initiated: state={}", state.get());
            return;
        }

        if (state.compareAndSet(PoolState.CREATED, PoolState.STOPPED)) {
            queue.close();
            log.warn("Email worker pool stopped before start, discarding {} buffered jobs", queue.size());
            stopped.countDown();
            return;
        }

        state.set(PoolState.DRAINING);
        log.info("Email worker pool stop requested, closing job queue: buffered={}", queue.size());
        queue.close();
    }

    /**
     * Called by each worker on exit.
     */
    private void onWorkerExit() {
        liveWorkers.decrementAndGet();
        releasePending(1);
    }

    /**
     * Releases pending slots and completes shutdown when none are left.
     *
     * @param count Slots to release.
     */
    private void releasePending(int count) {
        if (count <= 0 || pending.addAndGet(-count) != 0) {
            return;
        }

        // Workers can only all be gone early if they were interrupted.
        if (shutdownInitiated.compareAndSet(false, true)) {
            log.warn("All email workers exited unexpectedly, closing job queue: buffered={}", queue.size());
            queue.close();
        }

        state.set(PoolState.STOPPED);
        if (sendExecutor != null) {
            sendExecutor.shutdownNow();
        }
        log.info("All email workers have finished, shutdown complete");
        stopped.countDown();

        // Release the supervisor if it is still waiting for a cancellation that will not matter anymore.
        Thread watcher = supervisor;
        LifecycleContext context = lifecycle;
        if (watcher != null && context != null && !context.isCancelled()) {
            watcher.interrupt();
        }
    }

    public PoolState getState() {
        return state.get();
    }

    public int getQueueSize() {
        return queue.size();
    }

    public int getQueueCapacity() {
        return queue.capacity();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Gets the number of workers whose loop has not finished yet.
     * <p>Reaches zero before {@link PoolState#STOPPED} is reported.
     *
     * @return Live worker count.
     */
    public int getLiveWorkers() {
        return liveWorkers.get();
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }
}
