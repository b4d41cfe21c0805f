package com.strv.newsletter.worker;

import com.strv.newsletter.queue.EmailJob;

/**
 * Receives jobs whose delivery attempt failed.
 *
 * <p>Called on the worker thread after the failure has been logged and counted.
 * <br>The job is not requeued by the pool, whatever the handler does with it is up to the handler.
 * <p>Implementations must not block for long since the worker is unavailable meanwhile.
 *
 * @see LoggingFailedJobHandler
 */
@FunctionalInterface
public interface FailedJobHandler {

    /**
     * Handles a failed job.
     *
     * @param job   Failed job.
     * @param cause Transport failure or timeout.
     */
    void onFailure(EmailJob job, Throwable cause);
}
