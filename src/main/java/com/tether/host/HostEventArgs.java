package com.tether.host;

import java.util.Objects;

/**
 * Payload delivered with a host lifecycle notification.
 * 
 * Tether treats the payload as opaque apart from the document and view handles.
 * Either handle may be null when the event kind does not carry it.
 */
public record HostEventArgs(HostEvent event, String documentId, String viewId) {
    
    public HostEventArgs {
        Objects.requireNonNull(event, "event");
    }
    
    public static HostEventArgs forDocument(HostEvent event, String documentId) {
        return new HostEventArgs(event, documentId, null);
    }
    
    public static HostEventArgs forView(HostEvent event, String viewId) {
        return new HostEventArgs(event, null, viewId);
    }
}
