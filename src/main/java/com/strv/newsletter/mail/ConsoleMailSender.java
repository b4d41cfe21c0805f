package com.strv.newsletter.mail;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Mail sender that only logs the email.
 *
 * <p>Useful for development and tests where nothing should leave the process.
 */
public class ConsoleMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(ConsoleMailSender.class);

    @Override
    public void send(Duration timeout, String to, String subject, String body) throws MailSendException {
        if (Thread.currentThread().isInterrupted()) {
            throw new MailSendException("Send cancelled before logging email to " + to);
        }

        log.info("---- SENDING EMAIL (CONSOLE) ----");
        log.info("To: {}", to);
        log.info("Subject: {}", subject);
        log.info("Body:\n{}", body);
        log.info("---- END OF EMAIL (CONSOLE) ----");
    }
}
