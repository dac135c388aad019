package com.tether.lifecycle;

import com.tether.CommandContext;
import com.tether.config.ConfigLoadException;
import com.tether.config.ConfigService;
import com.tether.config.ConfigValidationException;
import com.tether.config.TetherConfig;
import com.tether.host.PathResolver;
import com.tether.paths.CompanionLibraryLoader;
import com.tether.paths.CompanionPaths;
import com.tether.scheduler.IdleTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * The one-time setup run through {@link InitializationGate}: resolve the
 * companion directories, load configuration, register search paths, locate the
 * geometry library and hook the idle scheduler into the host.
 */
public class CoreBootstrap implements CoreInitializer {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CoreBootstrap.class);
    
    private final Path moduleLocation;
    private final ConfigService configService;
    private final PathResolver pathResolver;
    private final CompanionLibraryLoader libraryLoader;
    private final IdleTaskScheduler scheduler;
    
    public CoreBootstrap(Path moduleLocation, ConfigService configService, PathResolver pathResolver,
                         CompanionLibraryLoader libraryLoader, IdleTaskScheduler scheduler) {
        this.moduleLocation = moduleLocation;
        this.configService = configService;
        this.pathResolver = pathResolver;
        this.libraryLoader = libraryLoader;
        this.scheduler = scheduler;
    }
    
    @Override
    public CoreEnvironment initialize(CommandContext context) throws InitializationException {
        CompanionPaths paths = CompanionPaths.fromModuleLocation(moduleLocation);
        
        TetherConfig config;
        try {
            config = configService.load(paths.coreDirectory());
        } catch (ConfigLoadException | ConfigValidationException e) {
            throw new InitializationException("Invalid Tether configuration: " + e.getMessage(), e);
        }
        
        paths.registerWith(pathResolver, config);
        Path geometryFactory = libraryLoader.resolveGeometryFactoryPath(paths.coreDirectory(), config);
        
        scheduler.bind(context.application());
        
        LOGGER.debug("Bootstrap complete: module {}, geometry factory {}", paths.moduleDirectory(), geometryFactory);
        return new CoreEnvironment(paths, config, geometryFactory);
    }
}
