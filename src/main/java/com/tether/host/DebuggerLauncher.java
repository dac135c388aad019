package com.tether.host;

/**
 * Suspends the entry point until an interactive debugger attaches.
 */
@FunctionalInterface
public interface DebuggerLauncher {
    
    void launch();
}
