package com.tether.scheduler;

/**
 * Marks the stretch of the UI thread during which {@link IdleTaskScheduler}
 * is draining inside the host's idle callback.
 * 
 * Host document mutations are only legal while this marker is set.
 */
public final class IdleContext {
    
    private static final ThreadLocal<Boolean> INSIDE = ThreadLocal.withInitial(() -> Boolean.FALSE);
    
    private IdleContext() {
    }
    
    /**
     * Checks whether the current thread is executing inside the idle context.
     * 
     * @return true while a scheduler drain is running on this thread
     */
    public static boolean isInIdleContext() {
        return INSIDE.get();
    }
    
    /**
     * Fails fast when called outside the idle context.
     * 
     * @param operation name of the operation, used in the error message
     * @throws IdleAffinityException if not inside the idle context
     */
    public static void requireIdleContext(String operation) {
        if (!isInIdleContext()) {
            throw new IdleAffinityException(String.format(
                "Operation '%s' must run on the idle context (thread: %s)",
                operation, Thread.currentThread().getName()));
        }
    }
    
    static void enter() {
        INSIDE.set(Boolean.TRUE);
    }
    
    static void exit() {
        INSIDE.remove();
    }
}
