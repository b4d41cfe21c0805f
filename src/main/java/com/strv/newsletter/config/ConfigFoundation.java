package com.strv.newsletter.config;

import com.google.gson.Gson;
import com.google.gson.stream.JsonReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration foundation.
 *
 * <p>Reads a JSON5 file into the configuration map.
 * <p>Before parsing, magic variables written as <code>{$NAME}</code> are replaced with
 * <br>the system property of the same name or, failing that, the environment variable.
 * <br>Unknown variables are replaced with an empty string.
 *
 * <p>Gson lenient parsing accepts comments, unquoted keys and single quotes.
 */
public class ConfigFoundation extends BasicConfig {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    private static final Pattern MAGIC = Pattern.compile("\\{\\$([A-Za-z0-9_.\\-]+)}");

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super();
        String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        this.map = parse(content);
        log.debug("Loaded configuration file: {}", path);
    }

    /**
     * Parses JSON5 content into a map after magic replacement.
     *
     * @param content JSON5 string.
     * @return Map, empty if content is blank.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parse(String content) {
        JsonReader reader = new JsonReader(new StringReader(magicReplace(content)));
        reader.setLenient(true);
        Map<String, Object> parsed = new Gson().fromJson(reader, Map.class);
        return parsed != null ? parsed : new HashMap<>();
    }

    /**
     * Replaces <code>{$NAME}</code> variables from system properties or environment.
     *
     * @param content String.
     * @return String.
     */
    public static String magicReplace(String content) {
        Matcher matcher = MAGIC.matcher(content);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = System.getProperty(name);
            if (value == null) {
                value = System.getenv(name);
            }
            if (value == null) {
                log.warn("Magic variable not set: {}", name);
                value = "";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
