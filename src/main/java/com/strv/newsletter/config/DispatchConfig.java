package com.strv.newsletter.config;

import java.io.IOException;
import java.util.Map;

/**
 * Dispatch configuration.
 *
 * <p>This class provides type safe access to the dispatch service configuration.
 * <p>Every section is optional, absent sections yield their defaults.
 *
 * @see WorkerConfig
 * @see MailConfig
 */
public class DispatchConfig extends ConfigFoundation {

    /**
     * Constructs a new DispatchConfig instance.
     */
    public DispatchConfig() {
        super();
    }

    /**
     * Constructs a new DispatchConfig instance.
     *
     * @param map Configuration map.
     */
    public DispatchConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new DispatchConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public DispatchConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets worker pool configuration.
     *
     * @return WorkerConfig instance.
     */
    public WorkerConfig getWorker() {
        return new WorkerConfig(getMapProperty("worker"));
    }

    /**
     * Gets mail transport configuration.
     *
     * @return MailConfig instance.
     */
    public MailConfig getMail() {
        return new MailConfig(getMapProperty("mail"));
    }

    /**
     * Gets application base URL used for unsubscribe links.
     *
     * @return Base URL without trailing slash.
     */
    public String getAppBaseUrl() {
        String url = new BasicConfig(getMapProperty("app")).getStringProperty("baseUrl", "http://localhost:8080");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Gets metrics endpoint configuration.
     *
     * @return BasicConfig instance.
     */
    public BasicConfig getMetrics() {
        return new BasicConfig(getMapProperty("metrics"));
    }
}
