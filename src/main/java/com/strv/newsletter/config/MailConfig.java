package com.strv.newsletter.config;

import java.util.Map;

/**
 * Mail transport configuration.
 *
 * <p>Selects the mail sender implementation and holds its settings.
 * <pre>
 * mail: {
 *   provider: "smtp",
 *   from: "newsletter@example.com",
 *   smtp: { host: "smtp.gmail.com", port: 587, password: "{$GOOGLE_APP_PASSWORD}" },
 *   resend: { baseUrl: "https://api.resend.com", apiKey: "{$RESEND_API_KEY}" }
 * }
 * </pre>
 */
@SuppressWarnings("rawtypes")
public class MailConfig extends BasicConfig {

    /**
     * Constructs a new MailConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public MailConfig(Map map) {
        super(map);
    }

    /**
     * Gets provider name.
     *
     * @return One of console, smtp or resend.
     */
    public String getProvider() {
        return getStringProperty("provider", "console");
    }

    /**
     * Gets sender address.
     *
     * @return From address string.
     */
    public String getFrom() {
        return getStringProperty("from", "");
    }

    /**
     * Gets SMTP host.
     *
     * @return Host string.
     */
    public String getSmtpHost() {
        return new BasicConfig(getMapProperty("smtp")).getStringProperty("host", "smtp.gmail.com");
    }

    /**
     * Gets SMTP port.
     *
     * @return Port number.
     */
    public int getSmtpPort() {
        return Math.toIntExact(new BasicConfig(getMapProperty("smtp")).getLongProperty("port", 587L));
    }

    /**
     * Gets SMTP password.
     *
     * @return Password string.
     */
    public String getSmtpPassword() {
        return new BasicConfig(getMapProperty("smtp")).getStringProperty("password", "");
    }

    /**
     * Gets Resend API base URL.
     *
     * @return URL string.
     */
    public String getResendBaseUrl() {
        return new BasicConfig(getMapProperty("resend")).getStringProperty("baseUrl", "https://api.resend.com");
    }

    /**
     * Gets Resend API key.
     *
     * @return API key string.
     */
    public String getResendApiKey() {
        return new BasicConfig(getMapProperty("resend")).getStringProperty("apiKey", "");
    }
}
