package com.strv.newsletter.config;

import java.time.Duration;
import java.util.Map;

/**
 * Worker pool configuration.
 *
 * <p>Values are passed through as configured, the pool substitutes its own defaults
 * <br>for zero or negative counts.
 */
@SuppressWarnings("rawtypes")
public class WorkerConfig extends BasicConfig {

    /**
     * Constructs a new WorkerConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public WorkerConfig(Map map) {
        super(map);
    }

    /**
     * Gets number of worker threads.
     *
     * @return Worker count.
     */
    public int getCount() {
        return Math.toIntExact(getLongProperty("count", 5L));
    }

    /**
     * Gets job queue capacity.
     *
     * @return Queue capacity.
     */
    public int getQueueCapacity() {
        return Math.toIntExact(getLongProperty("queueCapacity", 100L));
    }

    /**
     * Gets per job send timeout.
     *
     * @return Duration.
     */
    public Duration getSendTimeout() {
        return Duration.ofSeconds(getLongProperty("sendTimeoutSeconds", 30L));
    }

    /**
     * Gets overall shutdown deadline.
     * <p>Zero means wait for the drain to finish however long it takes.
     *
     * @return Duration.
     */
    public Duration getShutdownTimeout() {
        return Duration.ofSeconds(getLongProperty("shutdownTimeoutSeconds", 0L));
    }
}
