package com.tether.paths;

import java.nio.file.Path;

/**
 * Locator found through the test class path's service registration.
 */
public class StubGeometryLibraryLocator implements GeometryLibraryLocator {
    
    @Override
    public Path geometryFactoryPath(Path corePath, int version) {
        if (version < 1) {
            throw new IllegalArgumentException("Unsupported geometry version " + version);
        }
        return corePath.resolve("geometry-" + version + ".jar");
    }
}
