package com.example.shab;

/**
 * Invalid settings or unusable storage at startup. Fatal: no retry of a single
 * publication can fix it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
