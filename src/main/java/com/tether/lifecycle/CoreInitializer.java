package com.tether.lifecycle;

import com.tether.CommandContext;

/**
 * The side-effecting setup guarded by {@link InitializationGate}.
 */
@FunctionalInterface
public interface CoreInitializer {
    
    CoreEnvironment initialize(CommandContext context) throws InitializationException;
}
