package com.tether.host;

/**
 * The host command button that invokes Tether's entry point.
 * 
 * Disabled while a session is live so the entry point cannot be re-run,
 * re-enabled on detach, on startup failure and after a crash.
 */
public interface EntryPointControl {
    
    boolean isEnabled();
    
    void setEnabled(boolean enabled);
}
