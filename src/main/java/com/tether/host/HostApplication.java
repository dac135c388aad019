package com.tether.host;

import java.util.Optional;

/**
 * The part of the host application Tether depends on.
 * 
 * All methods are called from the host's UI thread. The host gives no
 * concurrency guarantees beyond that: handlers it invokes run on the same
 * thread, one at a time.
 */
public interface HostApplication {
    
    /**
     * Full product version name, for example "Autodesk Revit Architecture 2015".
     */
    String versionName();
    
    /**
     * Attaches a handler to a host event. Attaching the same handler twice
     * makes the host invoke it twice.
     */
    void addEventHandler(HostEvent event, HostEventHandler handler);
    
    /**
     * Detaches a handler previously attached with {@link #addEventHandler}.
     */
    void removeEventHandler(HostEvent event, HostEventHandler handler);
    
    /**
     * Attaches a callback invoked whenever the host has no pending interactive work.
     */
    void addIdleHandler(Runnable handler);
    
    void removeIdleHandler(Runnable handler);
    
    /**
     * The document currently active in the host, if any.
     */
    Optional<HostDocument> activeDocument();
}
