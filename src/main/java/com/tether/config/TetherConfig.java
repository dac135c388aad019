package com.tether.config;

import com.tether.config.ConfigSchema.FieldDefinition;
import com.tether.config.ConfigSchema.FieldType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated configuration read from {@code tether.json} in the core directory.
 */
public record TetherConfig(
    String nodesDirectory,
    List<String> preloadLibraries,
    String geometryLibrary,
    int geometryVersion,
    boolean crashPromptIncludesStackTrace,
    String workspaceJournalKey
) {
    
    public static final String FILE_NAME = "tether.json";
    
    private static final String FILE_NAME_PATTERN = "[A-Za-z0-9._-]+";
    
    public static final ConfigSchema SCHEMA = new ConfigSchema(Map.of(
        "nodesDirectory", new FieldDefinition.Builder()
            .type(FieldType.STRING).defaultValue("nodes").pattern(FILE_NAME_PATTERN).build(),
        "preloadLibraries", new FieldDefinition.Builder()
            .type(FieldType.STRING_LIST).defaultValue(List.of("tether-nodes.jar", "tether-raas.jar"))
            .pattern(FILE_NAME_PATTERN).build(),
        "geometryLibrary", new FieldDefinition.Builder()
            .type(FieldType.STRING).defaultValue("geometry-manager.jar").pattern(FILE_NAME_PATTERN).build(),
        "geometryVersion", new FieldDefinition.Builder()
            .type(FieldType.NUMBER).defaultValue(220).min(1).max(9999).build(),
        "crashPromptIncludesStackTrace", new FieldDefinition.Builder()
            .type(FieldType.BOOLEAN).defaultValue(true).build(),
        "workspaceJournalKey", new FieldDefinition.Builder()
            .type(FieldType.STRING).defaultValue("workspacePath").build()
    ));
    
    public TetherConfig {
        preloadLibraries = List.copyOf(preloadLibraries);
    }
    
    /**
     * Configuration with every field at its default.
     */
    public static TetherConfig defaults() {
        try {
            return fromMap(new HashMap<>());
        } catch (ConfigValidationException e) {
            throw new IllegalStateException("Default configuration does not satisfy its own schema", e);
        }
    }
    
    /**
     * Validates a raw map and converts it into a typed config.
     * 
     * @param raw field values, modified in place with defaults
     * @return the typed configuration
     * @throws ConfigValidationException if a field is invalid
     */
    @SuppressWarnings("unchecked")
    public static TetherConfig fromMap(Map<String, Object> raw) throws ConfigValidationException {
        SCHEMA.validate(raw);
        
        Number version = (Number) raw.get("geometryVersion");
        if (version.doubleValue() != Math.rint(version.doubleValue())) {
            throw new ConfigValidationException(
                String.format("Field 'geometryVersion' must be a whole number, got %s", version));
        }
        
        return new TetherConfig(
            (String) raw.get("nodesDirectory"),
            (List<String>) raw.get("preloadLibraries"),
            (String) raw.get("geometryLibrary"),
            version.intValue(),
            (Boolean) raw.get("crashPromptIncludesStackTrace"),
            (String) raw.get("workspaceJournalKey")
        );
    }
}
