package com.tether.session;

import com.tether.events.SubscriptionRegistry;
import com.tether.lifecycle.InitializationGate;
import com.tether.model.CoreModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the one live {@link Session}. Attaching creates a session with fresh
 * crash state; detaching drops it.
 */
public class SessionManager {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);
    
    private final InitializationGate initializationGate;
    private final SubscriptionRegistry subscriptions;
    private final List<Consumer<Session>> attachListeners = new CopyOnWriteArrayList<>();
    
    private Session current;
    private long nextId = 0;
    
    public SessionManager(InitializationGate initializationGate, SubscriptionRegistry subscriptions) {
        this.initializationGate = initializationGate;
        this.subscriptions = subscriptions;
    }
    
    /**
     * Creates the session for a freshly started core model.
     * 
     * @param coreModel the session's core model
     * @return the new session
     * @throws IllegalStateException if a session is already attached
     */
    public Session attach(CoreModel coreModel) {
        if (current != null) {
            throw new IllegalStateException(
                String.format("Cannot attach: %s is still live", current));
        }
        
        Session session = new Session(++nextId, coreModel, initializationGate, subscriptions);
        current = session;
        LOGGER.info("Attached {}", session);
        
        for (Consumer<Session> listener : attachListeners) {
            listener.accept(session);
        }
        return session;
    }
    
    /**
     * Drops the live session.
     * 
     * @return the detached session, or empty if none was attached
     */
    public Optional<Session> detach() {
        Session session = current;
        current = null;
        if (session != null) {
            LOGGER.info("Detached {}", session);
        }
        return Optional.ofNullable(session);
    }
    
    public Optional<Session> current() {
        return Optional.ofNullable(current);
    }
    
    public boolean isAttached() {
        return current != null;
    }
    
    public void addAttachListener(Consumer<Session> listener) {
        attachListeners.add(listener);
    }
}
