package com.tether.host;

/**
 * Host lifecycle notifications Tether listens to.
 * 
 * Each kind maps to exactly one host event source, so at most one handler
 * per kind is ever attached to the host.
 */
public enum HostEvent {
    
    /**
     * A view is about to become active. Carries the new view handle.
     */
    VIEW_ACTIVATING,
    
    /**
     * A view became active.
     */
    VIEW_ACTIVATED,
    
    /**
     * A document finished opening.
     */
    DOCUMENT_OPENED,
    
    /**
     * A document is about to close. Carries the closing document handle.
     */
    DOCUMENT_CLOSING,
    
    /**
     * A document finished closing.
     */
    DOCUMENT_CLOSED
}
