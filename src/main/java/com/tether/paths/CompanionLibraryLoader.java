package com.tether.paths;

import com.tether.config.TetherConfig;
import com.tether.lifecycle.InitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Asks the companion geometry library, installed next to the core rather than
 * on Tether's class path, where its geometry factory lives.
 * 
 * This is the only place Tether loads code dynamically.
 */
public class CompanionLibraryLoader {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CompanionLibraryLoader.class);
    
    /**
     * Resolves the geometry factory path through the companion library.
     * 
     * @param coreDirectory directory holding the companion library
     * @param config names the library and the requested version
     * @return the geometry factory path reported by the library
     * @throws InitializationException if the library or its locator is missing or fails
     */
    public Path resolveGeometryFactoryPath(Path coreDirectory, TetherConfig config) throws InitializationException {
        Path library = coreDirectory.resolve(config.geometryLibrary());
        if (!Files.isRegularFile(library)) {
            throw new InitializationException("Companion library not found: " + library);
        }
        
        URL url;
        try {
            url = library.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new InitializationException("Companion library path is not loadable: " + library, e);
        }
        
        try (URLClassLoader loader = new URLClassLoader(new URL[] {url}, getClass().getClassLoader())) {
            Optional<GeometryLibraryLocator> locator;
            try {
                locator = ServiceLoader.load(GeometryLibraryLocator.class, loader).findFirst();
            } catch (ServiceConfigurationError e) {
                throw new InitializationException(String.format(
                    "Companion library %s has a broken %s registration",
                    library.getFileName(), GeometryLibraryLocator.class.getName()), e);
            }
            if (locator.isEmpty()) {
                throw new InitializationException(String.format(
                    "Companion library %s does not provide %s",
                    library.getFileName(), GeometryLibraryLocator.class.getName()));
            }
            
            Path factory;
            try {
                factory = locator.get().geometryFactoryPath(coreDirectory, config.geometryVersion());
            } catch (RuntimeException e) {
                throw new InitializationException(String.format(
                    "Companion library %s failed to locate the geometry factory for version %d",
                    library.getFileName(), config.geometryVersion()), e);
            }
            if (factory == null) {
                throw new InitializationException(String.format(
                    "Companion library %s found no geometry factory for version %d",
                    library.getFileName(), config.geometryVersion()));
            }
            
            LOGGER.info("Geometry factory for version {}: {}", config.geometryVersion(), factory);
            return factory;
        } catch (IOException e) {
            throw new InitializationException("Failed to read companion library " + library, e);
        }
    }
}
