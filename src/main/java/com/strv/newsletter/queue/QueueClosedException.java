package com.strv.newsletter.queue;

/**
 * Thrown when a job is offered to a queue that no longer accepts work.
 *
 * <p>This happens once the worker pool has begun shutting down.
 */
public class QueueClosedException extends RuntimeException {

    /**
     * Constructs a new QueueClosedException instance.
     *
     * @param message Message.
     */
    public QueueClosedException(String message) {
        super(message);
    }
}
