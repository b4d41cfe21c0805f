/**
 * Email jobs and the bounded queue that hands them from producers to workers.
 *
 * <p>The {@link com.strv.newsletter.queue.BoundedJobQueue} is the only shared structure between
 * <br>request handling threads and the worker pool. It never holds more jobs than its capacity,
 * <br>producers wait for space instead.
 *
 * <p>Nothing here is persisted, buffered jobs are lost if the process dies before draining.
 *
 * @see com.strv.newsletter.queue.EmailJob
 * @see com.strv.newsletter.queue.EmailJobQueuer
 */
package com.strv.newsletter.queue;
