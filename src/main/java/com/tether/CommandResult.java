package com.tether;

/**
 * Result reported back to the host for one invocation of the entry point.
 */
public enum CommandResult {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
