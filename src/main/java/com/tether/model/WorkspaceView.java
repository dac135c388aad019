package com.tether.model;

import com.tether.host.UiDispatcher;

/**
 * The window showing a {@link ViewModel}, parented to the host's main window.
 */
public interface WorkspaceView {
    
    void show();
    
    UiDispatcher dispatcher();
    
    void addClosedListener(Runnable listener);
    
    void removeClosedListener(Runnable listener);
}
