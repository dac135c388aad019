package com.tether.paths;

import com.tether.config.TetherConfig;
import com.tether.host.PathResolver;
import com.tether.lifecycle.InitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory layout of an installation: Tether's module sits in a host-version
 * folder whose parent holds the core.
 */
public record CompanionPaths(Path moduleDirectory, Path coreDirectory) {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CompanionPaths.class);
    
    /**
     * Resolves the layout from the location Tether's module was loaded from.
     * 
     * @param moduleLocation the module jar (or class directory)
     * @return the module directory and its parent
     * @throws InitializationException if the module directory is missing or has no parent
     */
    public static CompanionPaths fromModuleLocation(Path moduleLocation) throws InitializationException {
        if (moduleLocation == null) {
            throw new InitializationException("Tether module location is unknown");
        }
        
        Path absolute = moduleLocation.toAbsolutePath().normalize();
        Path moduleDirectory = Files.isDirectory(absolute) ? absolute : absolute.getParent();
        if (moduleDirectory == null || !Files.isDirectory(moduleDirectory)) {
            throw new InitializationException("Tether module directory not found: " + moduleLocation);
        }
        
        Path coreDirectory = moduleDirectory.getParent();
        if (coreDirectory == null) {
            throw new InitializationException("Tether module directory has no parent: " + moduleDirectory);
        }
        
        return new CompanionPaths(moduleDirectory, coreDirectory);
    }
    
    /**
     * Location of the jar or class directory a class was loaded from.
     * 
     * @param type a class from the module
     * @return the code source location, or null if the class has none
     */
    public static Path locateModule(Class<?> type) {
        CodeSource source = type.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return null;
        }
        try {
            return Path.of(source.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOGGER.warn("Cannot turn code source {} into a path", source.getLocation(), e);
            return null;
        }
    }
    
    /**
     * Preload libraries in registration order.
     */
    public List<Path> preloadLibraries(TetherConfig config) {
        List<Path> libraries = new ArrayList<>();
        for (String name : config.preloadLibraries()) {
            libraries.add(moduleDirectory.resolve(name));
        }
        return libraries;
    }
    
    public Path nodeDirectory(TetherConfig config) {
        return moduleDirectory.resolve(config.nodesDirectory());
    }
    
    /**
     * Registers the layout: module directory for resolution, the core directory,
     * the preload libraries, then the extra node directory.
     */
    public void registerWith(PathResolver resolver, TetherConfig config) {
        resolver.addResolutionPath(moduleDirectory);
        resolver.initializeCore(coreDirectory);
        for (Path library : preloadLibraries(config)) {
            resolver.addPreloadLibrary(library);
        }
        resolver.addNodeDirectory(nodeDirectory(config));
        
        LOGGER.info("Registered companion paths: module {}, core {}", moduleDirectory, coreDirectory);
    }
}
