package com.pulsegrid.matrix.config;

/**
 * Fatal report configuration problem. Never retried; the run stops before any provider call.
 */
public class ConfigurationException extends RuntimeException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(message + " (" + key + ")");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
