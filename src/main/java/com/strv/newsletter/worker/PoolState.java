package com.strv.newsletter.worker;

/**
 * Email worker pool lifecycle states.
 * <p>Transitions only ever move forward: CREATED, RUNNING, DRAINING, STOPPED.
 */
public enum PoolState {

    /**
     * Queue allocated, no workers running. Jobs may already be buffered.
     */
    CREATED,

    /**
     * Workers running and accepting jobs.
     */
    RUNNING,

    /**
     * Shutdown requested. Queue closed to new jobs, workers finishing buffered ones.
     */
    DRAINING,

    /**
     * All workers exited.
     */
    STOPPED
}
