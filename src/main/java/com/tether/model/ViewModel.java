package com.tether.model;

import com.tether.cleanup.VisualizationState;

/**
 * The presentation model bound to a {@link CoreModel}.
 */
public interface ViewModel {
    
    /**
     * Closes the workspace UI.
     * 
     * @param allowCancellation whether the user may cancel the exit
     */
    void exit(boolean allowCancellation);
    
    VisualizationState visualization();
}
