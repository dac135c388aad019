package com.tether.crash;

import com.tether.host.EntryPointControl;
import com.tether.host.TelemetryCollector;
import com.tether.host.UnhandledExceptionEvent;
import com.tether.model.CoreModel;
import com.tether.model.ViewModel;
import com.tether.session.Session;
import com.tether.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.Optional;

/**
 * Handles exceptions escaping into the UI thread's dispatch loop.
 * 
 * Every notification is marked handled so the host never terminates. Only the
 * first one per session runs the crash sequence: log, telemetry, crash prompt
 * and a forced exit of the workspace UI. Each step is isolated, and the entry
 * point control is re-enabled whatever happens. The operation that crashed is
 * not retried.
 */
public class CrashRecoveryCoordinator {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CrashRecoveryCoordinator.class);
    
    private final SessionManager sessions;
    private final TelemetryCollector telemetry;
    private final EntryPointControl entryPointControl;
    private final boolean includeStackTrace;
    
    private CrashPhase phase = CrashPhase.IDLE;
    
    public CrashRecoveryCoordinator(SessionManager sessions, TelemetryCollector telemetry,
                                    EntryPointControl entryPointControl, boolean includeStackTrace) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.entryPointControl = Objects.requireNonNull(entryPointControl, "entryPointControl");
        this.includeStackTrace = includeStackTrace;
    }
    
    /**
     * Entry from the host's UI dispatcher.
     * 
     * @param event the unhandled exception notification
     */
    public void onUnhandledException(UnhandledExceptionEvent event) {
        event.setHandled(true);
        
        Throwable exception = event.getException();
        String message = messageOf(exception);
        
        Optional<Session> live = sessions.current();
        if (live.isEmpty()) {
            LOGGER.error("Unhandled UI exception with no live session: {}", message, exception);
            entryPointControl.setEnabled(true);
            return;
        }
        
        Session session = live.get();
        if (!session.crashState().markHandled(message)) {
            LOGGER.warn("Ignoring further unhandled UI exception in crashed {}: {}", session, message);
            entryPointControl.setEnabled(true);
            return;
        }
        
        phase = CrashPhase.CRASHED;
        CoreModel core = session.coreModel();
        ViewModel viewModel = session.viewModel();
        
        try {
            runStep("log", () -> {
                LOGGER.error("Unhandled exception in {}: {}", session, message, exception);
                core.logError("Unhandled exception");
                core.logError(message);
            });
            runStep("telemetry", () -> {
                telemetry.logException(exception);
                telemetry.notifyCrash();
            });
            runStep("crash prompt", () -> {
                core.markCrashing();
                core.requestCrashPrompt(details(exception, message));
            });
            runStep("exit", () -> {
                if (viewModel != null) {
                    viewModel.exit(false);
                }
            });
        } finally {
            event.setHandled(true);
            entryPointControl.setEnabled(true);
        }
    }
    
    /**
     * Called when a new session attaches; a crashed process counts as recovered.
     */
    public void onSessionAttached(Session session) {
        if (phase == CrashPhase.CRASHED) {
            phase = CrashPhase.RECOVERED;
            LOGGER.info("Recovered from previous crash with {}", session);
        }
    }
    
    public CrashPhase getPhase() {
        return phase;
    }
    
    private void runStep(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.warn("Crash handling step '{}' failed", step, e);
        }
    }
    
    private String details(Throwable exception, String message) {
        if (!includeStackTrace) {
            return message;
        }
        StringWriter trace = new StringWriter();
        exception.printStackTrace(new PrintWriter(trace));
        return message + "\n\n" + trace;
    }
    
    private static String messageOf(Throwable exception) {
        String message = exception.getMessage();
        return message != null ? message : exception.getClass().getName();
    }
}
