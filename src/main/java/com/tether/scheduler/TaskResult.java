package com.tether.scheduler;

import java.util.Optional;

/**
 * Outcome of a scheduled task's action.
 * 
 * @param sequence submission sequence number of the task
 * @param error the exception raised by the action, or null on success
 */
public record TaskResult(long sequence, Throwable error) {
    
    public static TaskResult success(long sequence) {
        return new TaskResult(sequence, null);
    }
    
    public static TaskResult failure(long sequence, Throwable error) {
        return new TaskResult(sequence, error);
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }
}
