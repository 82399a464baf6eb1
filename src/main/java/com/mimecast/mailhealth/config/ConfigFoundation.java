package com.mimecast.mailhealth.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Map;

/**
 * Typed access to a flat string configuration map.
 *
 * <p>Values are trimmed and blank values are treated as absent.
 */
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected final Map<String, String> map;

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, String> map) {
        this.map = map != null ? map : Collections.emptyMap();
    }

    /**
     * Checks if a non-blank property exists.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return StringUtils.isNotBlank(map.get(key));
    }

    /**
     * Gets a string property.
     *
     * @param key          Property key.
     * @param defaultValue Value returned when absent.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        return hasProperty(key) ? map.get(key).trim() : defaultValue;
    }

    /**
     * Gets a string property.
     *
     * @param key Property key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets a long property.
     *
     * @param key          Property key.
     * @param defaultValue Value returned when absent.
     * @return Long.
     * @throws IllegalArgumentException Value present but not a number.
     */
    public long getLongProperty(String key, long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        String value = map.get(key).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + value, e);
        }
    }

    /**
     * Gets a boolean property.
     * <p>True for <i>true</i>, <i>1</i> and <i>yes</i> in any case, false for anything else.
     *
     * @param key          Property key.
     * @param defaultValue Value returned when absent.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        String value = map.get(key).trim();
        return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
    }
}
