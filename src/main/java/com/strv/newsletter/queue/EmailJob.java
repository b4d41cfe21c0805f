package com.strv.newsletter.queue;

import java.util.Objects;

/**
 * One email to send.
 *
 * <p>Immutable once created by the producer and consumed exactly once by the worker that dequeues it.
 * <p>The newsletter identifier is only used to correlate log lines.
 * <p>No content validation is done here, producers are expected to supply a usable recipient and content.
 */
public final class EmailJob {

    private final String to;
    private final String subject;
    private final String body;
    private final String newsletterId;

    /**
     * Constructs a new EmailJob instance.
     *
     * @param to           Recipient address.
     * @param subject      Subject line.
     * @param body         Message body.
     * @param newsletterId Newsletter identifier for tracking.
     */
    public EmailJob(String to, String subject, String body, String newsletterId) {
        this.to = to;
        this.subject = subject;
        this.body = body;
        this.newsletterId = newsletterId;
    }

    public String getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public String getNewsletterId() {
        return newsletterId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailJob)) return false;
        EmailJob that = (EmailJob) o;
        return Objects.equals(to, that.to)
                && Objects.equals(subject, that.subject)
                && Objects.equals(body, that.body)
                && Objects.equals(newsletterId, that.newsletterId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(to, subject, body, newsletterId);
    }

    @Override
    public String toString() {
        return "EmailJob{to='" + to + "', subject='" + subject + "', newsletterId='" + newsletterId + "'}";
    }
}
