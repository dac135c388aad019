package com.tether;

import java.util.Objects;

/**
 * Result plus the message shown by the host; the message is set for FAILED and CANCELLED.
 */
public record CommandOutcome(CommandResult result, String message) {
    
    public CommandOutcome {
        Objects.requireNonNull(result, "result");
    }
    
    public static CommandOutcome succeeded() {
        return new CommandOutcome(CommandResult.SUCCEEDED, null);
    }
    
    public static CommandOutcome failed(String message) {
        return new CommandOutcome(CommandResult.FAILED, Objects.requireNonNull(message, "message"));
    }
    
    public static CommandOutcome cancelled(String message) {
        return new CommandOutcome(CommandResult.CANCELLED, message);
    }
}
