package com.strv.newsletter.issue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IssueRendererTest {

    private final IssueRenderer renderer = new IssueRenderer("https://news.example.com/");

    @Test
    void unsubscribeLink() {
        assertEquals("https://news.example.com/api/subscriptions/unsubscribe?token=abc123",
                renderer.unsubscribeLink("abc123"));
        assertEquals("https://news.example.com/api/subscriptions/unsubscribe?token=a%2Bb%3Dc%26d",
                renderer.unsubscribeLink("a+b=c&d"), "Token should be URL encoded");
    }

    @Test
    void renderIncludesGreetingContentAndFooter() {
        NewsletterIssue issue = new NewsletterIssue("nl-1", "post-7", "Weekly <News>", "<h1>Big story</h1>");
        String html = renderer.render(issue, new Subscriber("jane.doe@example.com", "tok"));

        assertTrue(html.contains("<p>Hi jane.doe,</p>"), "Greeting should use the address local part");
        assertTrue(html.contains("<h1>Big story</h1>"), "Issue HTML should be included as is");
        assertTrue(html.contains("<title>Weekly &lt;News&gt;</title>"), "Title should be escaped");
        assertTrue(html.contains("href=\"https://news.example.com/api/subscriptions/unsubscribe?token=tok\""),
                "Unsubscribe link should be present");
    }

    @Test
    void renderEscapesLinkAmpersand() {
        NewsletterIssue issue = new NewsletterIssue("nl-1", "post-7", "T", "");
        String html = new IssueRenderer("https://x.example.com/app?a=1&b=2").render(issue, new Subscriber("a@example.com", "t"));

        assertTrue(html.contains("app?a=1&amp;b=2"), "Attribute value should be escaped");
    }
}
