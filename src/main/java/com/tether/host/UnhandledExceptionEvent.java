package com.tether.host;

import java.util.Objects;

/**
 * Notification raised by the host's UI dispatcher when an exception escapes
 * into its dispatch loop.
 * 
 * A handler that leaves {@code handled} false lets the host terminate.
 */
public class UnhandledExceptionEvent {
    
    private final Throwable exception;
    private boolean handled;
    
    public UnhandledExceptionEvent(Throwable exception) {
        this.exception = Objects.requireNonNull(exception, "exception");
    }
    
    public Throwable getException() {
        return exception;
    }
    
    public boolean isHandled() {
        return handled;
    }
    
    public void setHandled(boolean handled) {
        this.handled = handled;
    }
}
