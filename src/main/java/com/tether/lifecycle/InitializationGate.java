package com.tether.lifecycle;

import com.tether.CommandContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs core initialization once per process.
 * 
 * The first successful call latches its {@link CoreEnvironment}; later calls
 * return it without repeating any side effect. A failed attempt latches
 * nothing, so the next invocation of the entry point tries again.
 */
public class InitializationGate {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(InitializationGate.class);
    
    private final CoreInitializer initializer;
    private final AtomicReference<CoreEnvironment> environment = new AtomicReference<>();
    private final AtomicInteger attempts = new AtomicInteger(0);
    private volatile Instant initializedAt;
    
    public InitializationGate(CoreInitializer initializer) {
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }
    
    /**
     * Initializes the core unless already done.
     * 
     * @param context the entry point invocation
     * @return the environment produced by the first successful initialization
     * @throws InitializationException if initialization fails
     */
    public CoreEnvironment initializeOnce(CommandContext context) throws InitializationException {
        CoreEnvironment existing = environment.get();
        if (existing != null) {
            LOGGER.debug("Core already initialized at {}, skipping", initializedAt);
            return existing;
        }
        
        int attempt = attempts.incrementAndGet();
        LOGGER.info("Initializing core (attempt {})", attempt);
        
        CoreEnvironment created;
        try {
            created = initializer.initialize(context);
        } catch (InitializationException e) {
            LOGGER.error("Core initialization failed: {}", e.getMessage());
            throw e;
        }
        
        if (created == null) {
            throw new InitializationException("Core initializer returned no environment");
        }
        
        environment.set(created);
        initializedAt = Instant.now();
        LOGGER.info("Core initialized from {}", created.paths().coreDirectory());
        return created;
    }
    
    public boolean isInitialized() {
        return environment.get() != null;
    }
    
    /**
     * The latched environment, or null before the first success.
     */
    public CoreEnvironment getEnvironment() {
        return environment.get();
    }
    
    public Instant getInitializedAt() {
        return initializedAt;
    }
}
