package com.tether.host;

import java.nio.file.Path;

/**
 * Path registry used by the core to locate its libraries.
 */
public interface PathResolver {
    
    void addResolutionPath(Path directory);
    
    void initializeCore(Path coreDirectory);
    
    void addPreloadLibrary(Path library);
    
    void addNodeDirectory(Path directory);
}
