package com.tether.lifecycle;

/**
 * Thrown when core initialization cannot complete: a companion resource is
 * missing or cannot be resolved. Fatal to the current attach attempt.
 */
public class InitializationException extends Exception {
    
    public InitializationException(String message) {
        super(message);
    }
    
    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
