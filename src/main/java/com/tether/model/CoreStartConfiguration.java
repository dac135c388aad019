package com.tether.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything the core model needs to start inside the host.
 * 
 * @param corePath directory holding the core libraries
 * @param geometryFactoryPath library implementing geometry for this host version
 * @param hostContext host name with product flavour stripped, see
 *        {@link com.tether.HostContextName}
 */
public record CoreStartConfiguration(Path corePath, Path geometryFactoryPath, String hostContext) {
    
    public CoreStartConfiguration {
        Objects.requireNonNull(corePath, "corePath");
        Objects.requireNonNull(geometryFactoryPath, "geometryFactoryPath");
        Objects.requireNonNull(hostContext, "hostContext");
    }
}
