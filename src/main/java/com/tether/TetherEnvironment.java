package com.tether;

import com.tether.config.ConfigService;
import com.tether.host.DebuggerLauncher;
import com.tether.host.EntryPointControl;
import com.tether.host.MessagePresenter;
import com.tether.host.PathResolver;
import com.tether.host.TelemetryCollector;
import com.tether.model.SessionComponentFactory;
import com.tether.paths.CompanionLibraryLoader;
import com.tether.paths.CompanionPaths;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The collaborators the host integration supplies to {@link TetherCommand}.
 */
public final class TetherEnvironment {
    
    private final Path moduleLocation;
    private final PathResolver pathResolver;
    private final SessionComponentFactory componentFactory;
    private final TelemetryCollector telemetry;
    private final EntryPointControl entryPointControl;
    private final MessagePresenter messagePresenter;
    private final DebuggerLauncher debuggerLauncher;
    private final ConfigService configService;
    private final CompanionLibraryLoader libraryLoader;
    
    private TetherEnvironment(Builder builder) {
        this.moduleLocation = builder.moduleLocation;
        this.pathResolver = builder.pathResolver;
        this.componentFactory = builder.componentFactory;
        this.telemetry = builder.telemetry;
        this.entryPointControl = builder.entryPointControl;
        this.messagePresenter = builder.messagePresenter;
        this.debuggerLauncher = builder.debuggerLauncher;
        this.configService = builder.configService;
        this.libraryLoader = builder.libraryLoader;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Path moduleLocation() { return moduleLocation; }
    public PathResolver pathResolver() { return pathResolver; }
    public SessionComponentFactory componentFactory() { return componentFactory; }
    public TelemetryCollector telemetry() { return telemetry; }
    public EntryPointControl entryPointControl() { return entryPointControl; }
    public MessagePresenter messagePresenter() { return messagePresenter; }
    public DebuggerLauncher debuggerLauncher() { return debuggerLauncher; }
    public ConfigService configService() { return configService; }
    public CompanionLibraryLoader libraryLoader() { return libraryLoader; }
    
    /**
     * Builder for the environment. Module location, config service, library
     * loader and debugger launcher have defaults; the rest is required.
     */
    public static class Builder {
        private Path moduleLocation;
        private PathResolver pathResolver;
        private SessionComponentFactory componentFactory;
        private TelemetryCollector telemetry;
        private EntryPointControl entryPointControl;
        private MessagePresenter messagePresenter;
        private DebuggerLauncher debuggerLauncher;
        private ConfigService configService;
        private CompanionLibraryLoader libraryLoader;
        
        public Builder moduleLocation(Path moduleLocation) {
            this.moduleLocation = moduleLocation;
            return this;
        }
        
        public Builder pathResolver(PathResolver pathResolver) {
            this.pathResolver = pathResolver;
            return this;
        }
        
        public Builder componentFactory(SessionComponentFactory componentFactory) {
            this.componentFactory = componentFactory;
            return this;
        }
        
        public Builder telemetry(TelemetryCollector telemetry) {
            this.telemetry = telemetry;
            return this;
        }
        
        public Builder entryPointControl(EntryPointControl entryPointControl) {
            this.entryPointControl = entryPointControl;
            return this;
        }
        
        public Builder messagePresenter(MessagePresenter messagePresenter) {
            this.messagePresenter = messagePresenter;
            return this;
        }
        
        public Builder debuggerLauncher(DebuggerLauncher debuggerLauncher) {
            this.debuggerLauncher = debuggerLauncher;
            return this;
        }
        
        public Builder configService(ConfigService configService) {
            this.configService = configService;
            return this;
        }
        
        public Builder libraryLoader(CompanionLibraryLoader libraryLoader) {
            this.libraryLoader = libraryLoader;
            return this;
        }
        
        public TetherEnvironment build() {
            Objects.requireNonNull(pathResolver, "pathResolver");
            Objects.requireNonNull(componentFactory, "componentFactory");
            Objects.requireNonNull(telemetry, "telemetry");
            Objects.requireNonNull(entryPointControl, "entryPointControl");
            Objects.requireNonNull(messagePresenter, "messagePresenter");
            if (moduleLocation == null) {
                moduleLocation = CompanionPaths.locateModule(TetherCommand.class);
            }
            if (configService == null) {
                configService = new ConfigService();
            }
            if (libraryLoader == null) {
                libraryLoader = new CompanionLibraryLoader();
            }
            if (debuggerLauncher == null) {
                debuggerLauncher = () -> { };
            }
            return new TetherEnvironment(this);
        }
    }
}
