package com.tether.config;

/**
 * Exception thrown when the configuration file cannot be read or parsed.
 */
public class ConfigLoadException extends Exception {
    
    public ConfigLoadException(String message) {
        super(message);
    }
    
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
