package com.strv.newsletter.mail;

import java.time.Duration;

/**
 * Mail transport used by the email workers.
 *
 * <p>Implementations block until the message is accepted or rejected by the transport.
 * <p>The timeout bounds the whole attempt. Implementations should apply it to their I/O
 * <br>and give up when the calling thread is interrupted.
 * <br>Workers enforce the same bound on their side, so a sender that ignores it is abandoned anyway.
 *
 * @see MailSenderFactory
 */
public interface MailSender {

    /**
     * Attempts delivery of one email.
     *
     * @param timeout Maximum duration of the attempt.
     * @param to      Recipient address.
     * @param subject Subject line.
     * @param body    Message body, HTML or plain text.
     * @throws MailSendException If the transport did not accept the message.
     */
    void send(Duration timeout, String to, String subject, String body) throws MailSendException;
}
