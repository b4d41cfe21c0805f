package com.strv.newsletter.mail;

/**
 * Delivery attempt failure.
 */
public class MailSendException extends Exception {

    /**
     * Constructs a new MailSendException instance.
     *
     * @param message Message.
     */
    public MailSendException(String message) {
        super(message);
    }

    /**
     * Constructs a new MailSendException instance.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public MailSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
