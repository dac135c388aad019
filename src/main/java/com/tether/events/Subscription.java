package com.tether.events;

import com.tether.host.HostEvent;
import com.tether.host.HostEventHandler;

/**
 * The registry's record of one host event kind.
 * 
 * Created on the first subscribe for its kind and kept afterwards; unsubscribe
 * only flips it inactive.
 */
public final class Subscription {
    
    private final HostEvent event;
    private HostEventHandler handler;
    private boolean active;
    
    Subscription(HostEvent event) {
        this.event = event;
    }
    
    public HostEvent event() {
        return event;
    }
    
    public boolean isActive() {
        return active;
    }
    
    /**
     * The handler currently attached to the host, or null when inactive.
     */
    public HostEventHandler handler() {
        return handler;
    }
    
    void activate(HostEventHandler handler) {
        this.handler = handler;
        this.active = true;
    }
    
    HostEventHandler deactivate() {
        HostEventHandler previous = handler;
        this.handler = null;
        this.active = false;
        return previous;
    }
    
    @Override
    public String toString() {
        return "Subscription[" + event + (active ? ", active]" : ", inactive]");
    }
}
