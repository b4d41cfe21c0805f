package com.strv.newsletter.issue;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Renders the email body of a newsletter issue for one subscriber.
 *
 * <p>The issue HTML is inserted as is, it is trusted editor content.
 * <br>The greeting and title are escaped.
 */
public class IssueRenderer {

    private static final String UNSUBSCRIBE_PATH = "/api/subscriptions/unsubscribe?token=";

    private static final String TEMPLATE = "<html>\n" +
            "<head>\n" +
            "<title>%s</title>\n" +
            "</head>\n" +
            "<body>\n" +
            "<p>Hi %s,</p>\n" +
            "%s\n" +
            "<hr>\n" +
            "<p><small>You are receiving this email because you subscribed to our newsletter.</small></p>\n" +
            "<p><small><a href=\"%s\">Unsubscribe</a></small></p>\n" +
            "</body>\n" +
            "</html>\n";

    private final String appBaseUrl;

    /**
     * Constructs a new IssueRenderer instance.
     *
     * @param appBaseUrl Public base URL of the API, without trailing slash.
     */
    public IssueRenderer(String appBaseUrl) {
        this.appBaseUrl = appBaseUrl.endsWith("/") ? appBaseUrl.substring(0, appBaseUrl.length() - 1) : appBaseUrl;
    }

    /**
     * Builds the unsubscribe link for a token.
     *
     * @param token Unsubscribe token.
     * @return Absolute URL.
     */
    public String unsubscribeLink(String token) {
        return appBaseUrl + UNSUBSCRIBE_PATH + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    /**
     * Renders the HTML body.
     *
     * @param issue      NewsletterIssue instance.
     * @param subscriber Subscriber instance.
     * @return HTML string.
     */
    public String render(NewsletterIssue issue, Subscriber subscriber) {
        return String.format(TEMPLATE,
                escape(issue.getTitle()),
                escape(subscriber.getRecipientName()),
                issue.getHtmlContent() != null ? issue.getHtmlContent() : "",
                escape(unsubscribeLink(subscriber.getUnsubscribeToken())));
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
