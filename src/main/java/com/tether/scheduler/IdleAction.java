package com.tether.scheduler;

/**
 * Unit of deferred work run on the host's idle context.
 */
@FunctionalInterface
public interface IdleAction {
    
    void run() throws Exception;
}
