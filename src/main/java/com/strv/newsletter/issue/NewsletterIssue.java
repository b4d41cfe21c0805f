package com.strv.newsletter.issue;

/**
 * A published post as it is sent to subscribers.
 */
public final class NewsletterIssue {

    private final String newsletterId;
    private final String postId;
    private final String title;
    private final String htmlContent;

    /**
     * Constructs a new NewsletterIssue instance.
     *
     * @param newsletterId Newsletter identifier.
     * @param postId       Post identifier.
     * @param title        Post title, used as the email subject.
     * @param htmlContent  Post content as HTML.
     */
    public NewsletterIssue(String newsletterId, String postId, String title, String htmlContent) {
        this.newsletterId = newsletterId;
        this.postId = postId;
        this.title = title;
        this.htmlContent = htmlContent;
    }

    public String getNewsletterId() {
        return newsletterId;
    }

    public String getPostId() {
        return postId;
    }

    public String getTitle() {
        return title;
    }

    public String getHtmlContent() {
        return htmlContent;
    }
}
