package com.tether.config;

/**
 * Exception thrown when a configuration value violates its schema.
 */
public class ConfigValidationException extends Exception {
    
    public ConfigValidationException(String message) {
        super(message);
    }
}
