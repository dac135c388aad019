package com.tether.crash;

/**
 * Crash recovery state of the process.
 */
public enum CrashPhase {
    
    /**
     * No crash since the process attached.
     */
    IDLE,
    
    /**
     * The live session hit an unhandled UI exception.
     */
    CRASHED,
    
    /**
     * A new session was attached after a crash.
     */
    RECOVERED
}
