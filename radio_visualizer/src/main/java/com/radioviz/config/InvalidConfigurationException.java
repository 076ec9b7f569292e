package com.radioviz.config;

/**
 * Thrown synchronously when an animator or layout is constructed with values
 * that cannot produce a valid animation.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Fail with the given message unless the condition holds.
     */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException(message);
        }
    }
}
