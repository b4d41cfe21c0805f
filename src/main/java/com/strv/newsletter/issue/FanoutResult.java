package com.strv.newsletter.issue;

/**
 * Outcome of fanning an issue out to subscribers.
 */
public final class FanoutResult {

    private final int enqueued;
    private final int skipped;

    FanoutResult(int enqueued, int skipped) {
        this.enqueued = enqueued;
        this.skipped = skipped;
    }

    /**
     * Jobs handed to the queue.
     */
    public int getEnqueued() {
        return enqueued;
    }

    /**
     * Subscribers left out for lack of an unsubscribe token.
     */
    public int getSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return "FanoutResult{enqueued=" + enqueued + ", skipped=" + skipped + "}";
    }
}
