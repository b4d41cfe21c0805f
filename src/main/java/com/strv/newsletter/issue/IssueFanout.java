package com.strv.newsletter.issue;

import com.strv.newsletter.queue.EmailJob;
import com.strv.newsletter.queue.EmailJobQueuer;
import com.strv.newsletter.queue.QueueClosedException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Turns a published issue into one email job per active subscriber.
 *
 * <p>Subscribers without an unsubscribe token are skipped, every email must carry a working link.
 * <p>Enqueueing blocks while the dispatch queue is full, so a large fan-out proceeds at the pace of the workers.
 */
public class IssueFanout {
    private static final Logger log = LogManager.getLogger(IssueFanout.class);

    private final EmailJobQueuer queuer;
    private final IssueRenderer renderer;

    /**
     * Constructs a new IssueFanout instance.
     *
     * @param queuer   Job queuer.
     * @param renderer Issue renderer.
     */
    public IssueFanout(EmailJobQueuer queuer, IssueRenderer renderer) {
        this.queuer = queuer;
        this.renderer = renderer;
    }

    /**
     * Enqueues the issue for every subscriber.
     *
     * @param issue       NewsletterIssue instance.
     * @param subscribers Active subscribers.
     * @return FanoutResult instance.
     * @throws QueueClosedException If the dispatch pool is shutting down.
     * @throws InterruptedException If interrupted while waiting for queue space.
     */
    public FanoutResult publish(NewsletterIssue issue, List<Subscriber> subscribers) throws InterruptedException {
        if (subscribers == null || subscribers.isEmpty()) {
            log.info("No active subscribers for newsletter {} to send post {}", issue.getNewsletterId(), issue.getPostId());
            return new FanoutResult(0, 0);
        }

        log.info("Enqueuing post {} for {} subscribers of newsletter {}",
                issue.getPostId(), subscribers.size(), issue.getNewsletterId());

        int enqueued = 0;
        int skipped = 0;
        for (Subscriber subscriber : subscribers) {
            if (StringUtils.isBlank(subscriber.getUnsubscribeToken())) {
                log.warn("Subscriber {} missing unsubscribe token, skipping post {}", subscriber.getEmail(), issue.getPostId());
                skipped++;
                continue;
            }

            queuer.enqueue(new EmailJob(
                    subscriber.getEmail(),
                    issue.getTitle(),
                    renderer.render(issue, subscriber),
                    issue.getNewsletterId()));
            enqueued++;
        }

        log.info("Finished enqueuing post {}: enqueued={}, skipped={}", issue.getPostId(), enqueued, skipped);
        return new FanoutResult(enqueued, skipped);
    }
}
