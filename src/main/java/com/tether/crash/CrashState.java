package com.tether.crash;

/**
 * Per-session record of the one crash the session is allowed to handle.
 */
public final class CrashState {
    
    private boolean handled;
    private String message;
    
    /**
     * Marks the crash handled.
     * 
     * @param message the exception message
     * @return true on the first call, false if a crash was already handled
     */
    public boolean markHandled(String message) {
        if (handled) {
            return false;
        }
        this.handled = true;
        this.message = message;
        return true;
    }
    
    public boolean isHandled() {
        return handled;
    }
    
    public String getMessage() {
        return message;
    }
}
