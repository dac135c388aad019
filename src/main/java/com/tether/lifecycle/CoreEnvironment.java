package com.tether.lifecycle;

import com.tether.config.TetherConfig;
import com.tether.paths.CompanionPaths;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What one-time initialization produced; reused by every later attach.
 */
public record CoreEnvironment(CompanionPaths paths, TetherConfig config, Path geometryFactoryPath) {
    
    public CoreEnvironment {
        Objects.requireNonNull(paths, "paths");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(geometryFactoryPath, "geometryFactoryPath");
    }
}
