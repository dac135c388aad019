package com.tether.session;

import com.tether.crash.CrashState;
import com.tether.events.SubscriptionRegistry;
import com.tether.lifecycle.InitializationGate;
import com.tether.model.CoreModel;
import com.tether.model.ViewModel;
import com.tether.model.WorkspaceView;

import java.time.Instant;
import java.util.Objects;

/**
 * Live state of one attach: the core model, its view model and window, and
 * the crash state.
 * 
 * A session always has a core model; the view model is attached afterwards
 * and at most once. Mutated only from the host's UI thread.
 */
public final class Session {
    
    private final long id;
    private final Instant attachedAt;
    private final CoreModel coreModel;
    private final CrashState crashState = new CrashState();
    private final InitializationGate initializationGate;
    private final SubscriptionRegistry subscriptions;
    
    private ViewModel viewModel;
    private WorkspaceView view;
    
    Session(long id, CoreModel coreModel, InitializationGate initializationGate,
            SubscriptionRegistry subscriptions) {
        this.id = id;
        this.attachedAt = Instant.now();
        this.coreModel = Objects.requireNonNull(coreModel, "coreModel");
        this.initializationGate = initializationGate;
        this.subscriptions = subscriptions;
    }
    
    public long id() {
        return id;
    }
    
    public Instant attachedAt() {
        return attachedAt;
    }
    
    public CoreModel coreModel() {
        return coreModel;
    }
    
    /**
     * The view model, or null before {@link #attachViewModel} ran.
     */
    public ViewModel viewModel() {
        return viewModel;
    }
    
    /**
     * Binds the view model created for this session's core model.
     * 
     * @param viewModel the view model
     * @throws IllegalStateException if a view model is already attached
     */
    public void attachViewModel(ViewModel viewModel) {
        Objects.requireNonNull(viewModel, "viewModel");
        if (this.viewModel != null) {
            throw new IllegalStateException(
                String.format("Session %d already has a view model", id));
        }
        this.viewModel = viewModel;
    }
    
    public WorkspaceView view() {
        return view;
    }
    
    public void attachView(WorkspaceView view) {
        Objects.requireNonNull(view, "view");
        if (viewModel == null) {
            throw new IllegalStateException(
                String.format("Session %d has no view model to show", id));
        }
        this.view = view;
    }
    
    public CrashState crashState() {
        return crashState;
    }
    
    /**
     * Whether the process-wide core initialization has completed.
     */
    public boolean isCoreInitialized() {
        return initializationGate != null && initializationGate.isInitialized();
    }
    
    /**
     * Whether every host lifecycle event currently has Tether's handler attached.
     */
    public boolean areApplicationEventsSubscribed() {
        return subscriptions != null && subscriptions.isSubscribed();
    }
    
    @Override
    public String toString() {
        return "Session[" + id + "]";
    }
}
