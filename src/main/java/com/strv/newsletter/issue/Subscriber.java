package com.strv.newsletter.issue;

/**
 * Active subscriber of a newsletter.
 */
public final class Subscriber {

    private final String email;
    private final String unsubscribeToken;

    /**
     * Constructs a new Subscriber instance.
     *
     * @param email            Subscriber address.
     * @param unsubscribeToken Token for the unsubscribe link.
     */
    public Subscriber(String email, String unsubscribeToken) {
        this.email = email;
        this.unsubscribeToken = unsubscribeToken;
    }

    public String getEmail() {
        return email;
    }

    public String getUnsubscribeToken() {
        return unsubscribeToken;
    }

    /**
     * Name used in the greeting, the local part of the address.
     *
     * @return Recipient name, or the whole address when it has no local part.
     */
    public String getRecipientName() {
        int at = email != null ? email.indexOf('@') : -1;
        return at > 0 ? email.substring(0, at) : email;
    }
}
