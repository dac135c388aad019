package com.tether.host;

import java.util.function.Consumer;

/**
 * The dispatcher driving the UI thread that owns Tether's window.
 */
public interface UiDispatcher {
    
    void addUnhandledExceptionHandler(Consumer<UnhandledExceptionEvent> handler);
    
    void removeUnhandledExceptionHandler(Consumer<UnhandledExceptionEvent> handler);
}
