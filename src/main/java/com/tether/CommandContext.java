package com.tether;

import com.tether.host.HostApplication;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One invocation of the entry point: the host application plus the journal
 * data bag the host passes alongside it.
 */
public record CommandContext(HostApplication application, Map<String, String> journalData) {
    
    public static final String DEBUG_KEY = "debug";
    
    public CommandContext {
        Objects.requireNonNull(application, "application");
        journalData = journalData == null ? Map.of() : Map.copyOf(journalData);
    }
    
    public static CommandContext of(HostApplication application) {
        return new CommandContext(application, Map.of());
    }
    
    public Optional<String> journalValue(String key) {
        return Optional.ofNullable(journalData.get(key));
    }
}
