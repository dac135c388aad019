package com.tether.host;

/**
 * Callback attached to a single host lifecycle event.
 */
@FunctionalInterface
public interface HostEventHandler {
    
    void handle(HostEventArgs args);
}
