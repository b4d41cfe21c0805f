package com.strv.newsletter.mail;

import com.strv.newsletter.config.MailConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory for creating MailSender instances based on configuration.
 * <p>Selects the transport from {@code mail.provider}:
 * <ul>
 *   <li>{@code smtp} - SMTP submission with STARTTLS</li>
 *   <li>{@code resend} - Resend HTTP API</li>
 *   <li>{@code console} - log only, also the fallback for unknown values</li>
 * </ul>
 */
public class MailSenderFactory {
    private static final Logger log = LogManager.getLogger(MailSenderFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private MailSenderFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates a MailSender from configuration.
     *
     * @param config MailConfig instance.
     * @return MailSender instance.
     * @throws IllegalArgumentException If the chosen transport is missing required settings.
     */
    public static MailSender createMailSender(MailConfig config) {
        String provider = config.getProvider().trim().toLowerCase();
        switch (provider) {
            case "smtp":
                log.info("Using SMTP mail sender: host={}, port={}, from={}",
                        config.getSmtpHost(), config.getSmtpPort(), config.getFrom());
                return new SmtpMailSender(config.getFrom(), config.getSmtpPassword(), config.getSmtpHost(), config.getSmtpPort());

            case "resend":
                log.info("Using Resend mail sender: baseUrl={}, from={}", config.getResendBaseUrl(), config.getFrom());
                return new ResendMailSender(config.getResendBaseUrl(), config.getResendApiKey(), config.getFrom());

            case "console":
                log.info("Using console mail sender");
                return new ConsoleMailSender();

            default:
                log.warn("Unknown mail provider {}, using console mail sender", provider);
                return new ConsoleMailSender();
        }
    }
}
