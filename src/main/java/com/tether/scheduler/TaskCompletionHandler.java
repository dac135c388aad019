package com.tether.scheduler;

/**
 * Invoked on the idle context right after a task's action finished,
 * before the next task starts.
 */
@FunctionalInterface
public interface TaskCompletionHandler {
    
    void onCompleted(TaskResult result);
}
