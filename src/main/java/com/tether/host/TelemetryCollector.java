package com.tether.host;

/**
 * Instrumentation sink. Transport is owned by the host environment.
 */
public interface TelemetryCollector {
    
    void logException(Throwable exception);
    
    void notifyCrash();
}
