package com.tether.events;

import com.tether.host.HostApplication;
import com.tether.host.HostEvent;
import com.tether.host.HostEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps at most one handler attached to the host per {@link HostEvent}.
 * 
 * The host may run Tether's entry point several times per process without a
 * matching detach, so subscribing is idempotent per kind: an active kind is
 * left alone, an inactive one is attached. Unsubscribing is idempotent too.
 * Every call happens on the host's UI thread.
 */
public class SubscriptionRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionRegistry.class);
    
    private final HostApplication application;
    private final Map<HostEvent, Subscription> subscriptions = new EnumMap<>(HostEvent.class);
    
    public SubscriptionRegistry(HostApplication application) {
        this.application = Objects.requireNonNull(application, "application");
    }
    
    /**
     * Attaches each handler whose event kind is not already active.
     * 
     * @param handlers the handlers to attach
     */
    public void subscribe(ApplicationEventHandlers handlers) {
        int attached = 0;
        for (HostEvent event : handlers.events()) {
            if (add(event, handlers.get(event))) {
                attached++;
            }
        }
        LOGGER.info("Subscribed to host events: {} attached, {} already active",
            attached, handlers.events().size() - attached);
    }
    
    /**
     * Detaches the handlers for every event kind in the given set that is active.
     * 
     * @param handlers the handler set whose kinds should be detached
     */
    public void unsubscribe(ApplicationEventHandlers handlers) {
        int detached = 0;
        for (HostEvent event : handlers.events()) {
            if (remove(event)) {
                detached++;
            }
        }
        LOGGER.info("Unsubscribed from host events: {} detached", detached);
    }
    
    /**
     * Attaches a handler for one event kind unless the kind is already active.
     * 
     * @param event the event kind
     * @param handler the handler to attach
     * @return true if the handler was attached, false if the kind was already active
     */
    public boolean add(HostEvent event, HostEventHandler handler) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(handler, "handler");
        
        Subscription subscription = subscriptions.computeIfAbsent(event, Subscription::new);
        if (subscription.isActive()) {
            LOGGER.debug("Host event {} already has a handler, skipping", event);
            return false;
        }
        
        application.addEventHandler(event, handler);
        subscription.activate(handler);
        LOGGER.debug("Attached handler for host event {}", event);
        return true;
    }
    
    /**
     * Detaches the handler of one event kind if it is active.
     * 
     * @param event the event kind
     * @return true if a handler was detached, false if the kind was inactive
     */
    public boolean remove(HostEvent event) {
        Subscription subscription = subscriptions.get(event);
        if (subscription == null || !subscription.isActive()) {
            return false;
        }
        
        HostEventHandler handler = subscription.deactivate();
        application.removeEventHandler(event, handler);
        LOGGER.debug("Detached handler for host event {}", event);
        return true;
    }
    
    public boolean isActive(HostEvent event) {
        Subscription subscription = subscriptions.get(event);
        return subscription != null && subscription.isActive();
    }
    
    /**
     * Number of handlers this registry has attached for the kind: always 0 or 1.
     */
    public int activeCount(HostEvent event) {
        return isActive(event) ? 1 : 0;
    }
    
    /**
     * True while every host event kind has an attached handler.
     */
    public boolean isSubscribed() {
        for (HostEvent event : HostEvent.values()) {
            if (!isActive(event)) {
                return false;
            }
        }
        return true;
    }
    
    public Map<HostEvent, Subscription> getSubscriptions() {
        return Collections.unmodifiableMap(subscriptions);
    }
}
