package com.strv.newsletter.main;

import com.strv.newsletter.config.DispatchConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration initializer and container.
 *
 * <p>Holds the loaded dispatch configuration for the lifetime of the process.
 * <p>Until {@link #init(String)} is called an empty configuration is served, which yields every default.
 *
 * @see DispatchConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Dispatch configuration.
     */
    private static volatile DispatchConfig dispatch = new DispatchConfig();

    /**
     * Gets dispatch configuration.
     *
     * @return DispatchConfig instance.
     */
    public static DispatchConfig getDispatch() {
        return dispatch;
    }

    /**
     * Initializes dispatch configuration from file.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void init(String path) throws IOException {
        dispatch = new DispatchConfig(path);
        log.info("Loaded dispatch configuration: {}", path);
    }

    /**
     * Replaces dispatch configuration.
     *
     * @param config DispatchConfig instance.
     */
    public static void set(DispatchConfig config) {
        dispatch = config != null ? config : new DispatchConfig();
    }
}
