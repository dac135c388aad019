package com.tether.scheduler;

/**
 * Thrown when an operation that must run on the host's idle context is
 * invoked anywhere else.
 */
public class IdleAffinityException extends IllegalStateException {
    
    public IdleAffinityException(String message) {
        super(message);
    }
}
