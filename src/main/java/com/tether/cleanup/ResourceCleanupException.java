package com.tether.cleanup;

/**
 * Thrown when a host transaction or deletion fails while cleaning up a marker.
 */
public class ResourceCleanupException extends RuntimeException {
    
    public ResourceCleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
