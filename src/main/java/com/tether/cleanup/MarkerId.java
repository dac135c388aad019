package com.tether.cleanup;

/**
 * Opaque identity of a host element Tether created to visualize work in progress.
 */
public record MarkerId(long value) {
    
    /**
     * Sentinel for "no marker" or "already claimed for deletion".
     */
    public static final MarkerId INVALID = new MarkerId(-1L);
    
    public boolean isValid() {
        return value >= 0;
    }
    
    @Override
    public String toString() {
        return isValid() ? "MarkerId[" + value + "]" : "MarkerId[invalid]";
    }
}
