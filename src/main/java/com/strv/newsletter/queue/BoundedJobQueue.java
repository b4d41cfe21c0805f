package com.strv.newsletter.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed capacity FIFO hand-off between producers and workers.
 *
 * <p>Producers block in {@link #put(EmailJob)} while the queue is full.
 * <br>Consumers block in {@link #take()} while it is empty and still open.
 *
 * <p>Once closed the queue rejects new jobs but keeps handing out buffered ones.
 * <br>{@link #take()} only reports the end of the stream when the queue is both closed and empty.
 *
 * <p>A {@link java.util.concurrent.BlockingQueue} has no notion of closing, so this guards
 * <br>an {@link ArrayDeque} with a single lock and two conditions instead.
 */
public class BoundedJobQueue {
    private static final Logger log = LogManager.getLogger(BoundedJobQueue.class);

    /**
     * Capacity used when a zero or negative value is configured.
     */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ArrayDeque<EmailJob> items;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed = false;

    /**
     * Constructs a new BoundedJobQueue instance.
     *
     * @param capacity Maximum resident jobs, zero or negative selects {@link #DEFAULT_CAPACITY}.
     */
    public BoundedJobQueue(int capacity) {
        if (capacity <= 0) {
            log.warn("Invalid queue capacity {}, using default {}", capacity, DEFAULT_CAPACITY);
            capacity = DEFAULT_CAPACITY;
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Adds a job to the tail of the queue, waiting for space if necessary.
     *
     * @param job EmailJob instance.
     * @throws QueueClosedException If the queue is closed before space becomes available.
     * @throws InterruptedException If interrupted while waiting.
     */
    public void put(EmailJob job) throws InterruptedException {
        if (job == null) {
            throw new NullPointerException("job");
        }

        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                throw new QueueClosedException("Email job queue is closed");
            }
            items.addLast(job);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head of the queue, waiting for a job if necessary.
     *
     * @return Job, or empty once the queue is closed and drained.
     * @throws InterruptedException If interrupted while waiting.
     */
    public Optional<EmailJob> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            EmailJob job = items.pollFirst();
            if (job != null) {
                notFull.signal();
            }
            return Optional.ofNullable(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue for new jobs.
     * <p>Wakes all blocked producers and consumers. Safe to call more than once.
     *
     * @return True if this call closed the queue, false if it was already closed.
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            log.debug("Email job queue closed: buffered={}", items.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Is the queue closed.
     *
     * @return Boolean.
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of jobs currently buffered.
     *
     * @return Size.
     */
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fixed capacity.
     *
     * @return Capacity.
     */
    public int capacity() {
        return capacity;
    }
}
