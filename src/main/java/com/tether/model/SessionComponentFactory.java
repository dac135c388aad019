package com.tether.model;

import com.tether.host.HostApplication;

/**
 * Builds the per-session components. Implemented by the host integration;
 * tests supply fakes.
 */
public interface SessionComponentFactory {
    
    CoreModel startCore(CoreStartConfiguration configuration, HostApplication application);
    
    ViewModel startViewModel(CoreModel coreModel);
    
    WorkspaceView createView(ViewModel viewModel);
}
