package com.tether.paths;

import java.nio.file.Path;

/**
 * Capability implemented by the companion geometry library and discovered
 * through {@link java.util.ServiceLoader}.
 */
public interface GeometryLibraryLocator {
    
    /**
     * Locates the geometry factory matching the requested version.
     * 
     * @param corePath the core directory
     * @param version geometry library version
     * @return path to the geometry factory library
     */
    Path geometryFactoryPath(Path corePath, int version);
}
