package com.radioviz.config;

/**
 * Raised when a settings document exists but cannot be read or parsed.
 */
public class ConfigurationLoadException extends RuntimeException {

    public ConfigurationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
