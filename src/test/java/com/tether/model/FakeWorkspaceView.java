package com.tether.model;

import com.tether.host.FakeUiDispatcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Workspace window that tests can close.
 */
public class FakeWorkspaceView implements WorkspaceView {
    
    private final FakeUiDispatcher dispatcher = new FakeUiDispatcher();
    private final List<Runnable> closedListeners = new CopyOnWriteArrayList<>();
    private boolean shown;
    private boolean closed;
    
    @Override
    public void show() {
        shown = true;
    }
    
    @Override
    public FakeUiDispatcher dispatcher() {
        return dispatcher;
    }
    
    @Override
    public void addClosedListener(Runnable listener) {
        closedListeners.add(listener);
    }
    
    @Override
    public void removeClosedListener(Runnable listener) {
        closedListeners.remove(listener);
    }
    
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Runnable listener : closedListeners) {
            listener.run();
        }
    }
    
    public boolean isShown() { return shown; }
    public boolean isClosed() { return closed; }
    public int closedListenerCount() { return closedListeners.size(); }
}
