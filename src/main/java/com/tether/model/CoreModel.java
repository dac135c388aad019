package com.tether.model;

import java.nio.file.Path;

/**
 * The computation engine Tether hosts. Owned exclusively by one session.
 * 
 * The engine's internals are outside Tether; this is the surface the
 * session, the event handlers and the crash coordinator call into.
 */
public interface CoreModel {
    
    /**
     * Runs the steps that need the model fully constructed (document binding,
     * updater registration).
     */
    void handlePostInitialization();
    
    void handleDocumentOpened();
    
    void handleDocumentClosing(String documentId);
    
    void handleDocumentClosed();
    
    /**
     * Enables or disables running based on whether the given view supports it.
     */
    void setRunEnabledForView(String viewId);
    
    void handleViewActivated();
    
    /**
     * Registers a callback invoked once when the model starts shutting down.
     */
    void addShutdownListener(Runnable listener);
    
    void openFile(Path workspace);
    
    /**
     * Flags the model as crashing so that shutdown skips work that could corrupt state.
     */
    void markCrashing();
    
    /**
     * Asks the view layer to show the crash prompt.
     * 
     * @param details message and stack trace text
     */
    void requestCrashPrompt(String details);
    
    /**
     * Writes to the model's own log, which the user can see in the UI.
     */
    void logError(String message);
    
    /**
     * Releases updaters and closes the model's log.
     */
    void dispose();
}
