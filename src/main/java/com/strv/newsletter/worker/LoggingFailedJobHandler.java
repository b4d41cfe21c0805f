package com.strv.newsletter.worker;

import com.strv.newsletter.queue.EmailJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default failed job handler.
 * <p>Logs the dropped job. Nothing is retried.
 */
public class LoggingFailedJobHandler implements FailedJobHandler {
    private static final Logger log = LogManager.getLogger(LoggingFailedJobHandler.class);

    @Override
    public void onFailure(EmailJob job, Throwable cause) {
        log.warn("Email job dropped without retry: to={}, newsletterId={}, subject={}, cause={}",
                job.getTo(), job.getNewsletterId(), job.getSubject(), cause.getMessage());
    }
}
