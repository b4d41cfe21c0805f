package com.strv.newsletter.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Basic configuration container.
 *
 * <p>Wraps a configuration map and provides type safe accessors with defaults.
 * <p>Numbers parsed from JSON come back as doubles, the long accessor handles that.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return (long) Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long or 0.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, 0L);
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return def;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean or false.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    public Map getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map) value : new HashMap<>();
    }
}
