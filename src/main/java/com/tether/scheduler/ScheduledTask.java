package com.tether.scheduler;

import java.util.Objects;
import java.util.Optional;

/**
 * A deferred action plus an optional completion handler.
 * 
 * Consumed exactly once by {@link IdleTaskScheduler}; a task has no
 * cancellation token, once queued it runs or fails.
 */
public final class ScheduledTask {
    
    private final String name;
    private final IdleAction action;
    private final TaskCompletionHandler completion;
    
    private ScheduledTask(String name, IdleAction action, TaskCompletionHandler completion) {
        this.name = Objects.requireNonNull(name, "name");
        this.action = Objects.requireNonNull(action, "action");
        this.completion = completion;
    }
    
    public static ScheduledTask of(String name, IdleAction action) {
        return new ScheduledTask(name, action, null);
    }
    
    public static ScheduledTask of(String name, IdleAction action, TaskCompletionHandler completion) {
        return new ScheduledTask(name, action, completion);
    }
    
    public String name() {
        return name;
    }
    
    IdleAction action() {
        return action;
    }
    
    Optional<TaskCompletionHandler> completion() {
        return Optional.ofNullable(completion);
    }
    
    @Override
    public String toString() {
        return "ScheduledTask[" + name + "]";
    }
}
