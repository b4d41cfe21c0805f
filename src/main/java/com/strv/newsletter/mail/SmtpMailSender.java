package com.strv.newsletter.mail;

import jakarta.mail.*;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP mail sender using Jakarta Mail.
 *
 * <p>Authenticates with the sender address and an app password, then upgrades with STARTTLS.
 * <br>Defaults match Gmail submission on port 587.
 * <p>Bodies starting with <code>&lt;</code> are sent as HTML, anything else as plain text.
 */
public class SmtpMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(SmtpMailSender.class);

    private final String from;
    private final String password;
    private final String host;
    private final int port;

    /**
     * Constructs a new SmtpMailSender instance.
     *
     * @param from     Sender address, also used as SMTP username.
     * @param password SMTP password.
     * @param host     SMTP host.
     * @param port     SMTP port.
     * @throws IllegalArgumentException If any setting is missing.
     */
    public SmtpMailSender(String from, String password, String host, int port) {
        if (StringUtils.isBlank(from)) {
            throw new IllegalArgumentException("email from address is required");
        }
        if (StringUtils.isBlank(password)) {
            throw new IllegalArgumentException("email password is required");
        }
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("SMTP host is required");
        }
        if (port <= 0) {
            throw new IllegalArgumentException("SMTP port is required");
        }
        this.from = from;
        this.password = password;
        this.host = host;
        this.port = port;
    }

    @Override
    public void send(Duration timeout, String to, String subject, String body) throws MailSendException {
        if (Thread.currentThread().isInterrupted()) {
            throw new MailSendException("Send cancelled before connecting for " + to);
        }

        Session session = Session.getInstance(buildProperties(timeout), new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(from, password);
            }
        });

        log.debug("Attempting to send email from {} to {} via {}:{}", from, to, host, port);
        try {
            Transport.send(buildMessage(session, to, subject, body));
        } catch (MessagingException e) {
            throw new MailSendException("SMTP send (from: " + from + ", to: " + to + ") failed: " + e.getMessage(), e);
        }
        log.debug("Email sent from {} to {}", from, to);
    }

    /**
     * Builds Jakarta Mail session properties.
     * <p>Connect, read and write timeouts all use the per send timeout.
     *
     * @param timeout Send timeout.
     * @return Properties instance.
     */
    Properties buildProperties(Duration timeout) {
        String millis = String.valueOf(Math.max(1L, timeout.toMillis()));

        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", millis);
        props.put("mail.smtp.timeout", millis);
        props.put("mail.smtp.writetimeout", millis);
        return props;
    }

    /**
     * Builds the MIME message.
     *
     * @param session Mail session.
     * @param to      Recipient address.
     * @param subject Subject line.
     * @param body    Body.
     * @return MimeMessage instance.
     * @throws MessagingException If an address or header is invalid.
     */
    MimeMessage buildMessage(Session session, String to, String subject, String body) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());

        String content = body != null ? body : "";
        if (content.stripLeading().startsWith("<")) {
            message.setText(content, StandardCharsets.UTF_8.name(), "html");
        } else {
            message.setText(content, StandardCharsets.UTF_8.name());
        }
        return message;
    }
}
