/**
 * Email worker pool.
 *
 * <p>A fixed number of worker threads drain the shared job queue and hand each job to the mail sender,
 * <br>each attempt bounded by the send timeout.
 *
 * <p>Shutdown happens once, whether it comes from cancelling the {@link com.strv.newsletter.worker.LifecycleContext}
 * <br>or from {@link com.strv.newsletter.worker.EmailWorkerPool#stop()}. The queue is closed and the workers
 * <br>exit once it is drained, after which the pool reports {@link com.strv.newsletter.worker.PoolState#STOPPED}.
 *
 * <p>Failed deliveries go to a {@link com.strv.newsletter.worker.FailedJobHandler} and are not retried.
 */
package com.strv.newsletter.worker;
