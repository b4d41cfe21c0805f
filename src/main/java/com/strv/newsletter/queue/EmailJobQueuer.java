package com.strv.newsletter.queue;

/**
 * Producer facing contract for submitting email jobs.
 *
 * <p>Keeps producers decoupled from the worker pool implementation.
 */
public interface EmailJobQueuer {

    /**
     * Submits a job for asynchronous delivery.
     * <p>Blocks the calling thread while the queue is full.
     *
     * @param job EmailJob instance.
     * @throws QueueClosedException If shutdown has begun.
     * @throws InterruptedException If interrupted while waiting for space.
     */
    void enqueue(EmailJob job) throws InterruptedException;
}
