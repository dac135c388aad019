package com.tether.crash;

import com.tether.events.SubscriptionRegistry;
import com.tether.host.FakeEntryPointControl;
import com.tether.host.FakeHostApplication;
import com.tether.host.TelemetryCollector;
import com.tether.host.UnhandledExceptionEvent;
import com.tether.lifecycle.InitializationGate;
import com.tether.model.CoreModel;
import com.tether.model.FakeViewModel;
import com.tether.session.Session;
import com.tether.session.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CrashRecoveryCoordinatorTest {
    
    @Mock
    private CoreModel coreModel;
    
    @Mock
    private TelemetryCollector telemetry;
    
    private FakeEntryPointControl control;
    private SessionManager sessions;
    private CrashRecoveryCoordinator coordinator;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        control = new FakeEntryPointControl();
        control.setEnabled(false);
        sessions = new SessionManager(new InitializationGate(context -> null),
            new SubscriptionRegistry(new FakeHostApplication()));
        coordinator = new CrashRecoveryCoordinator(sessions, telemetry, control, true);
        sessions.addAttachListener(coordinator::onSessionAttached);
    }
    
    private FakeViewModel attachSession() {
        Session session = sessions.attach(coreModel);
        FakeViewModel viewModel = new FakeViewModel();
        session.attachViewModel(viewModel);
        return viewModel;
    }
    
    @Test
    void testFirstCrashRunsFullSequence() {
        FakeViewModel viewModel = attachSession();
        RuntimeException failure = new IllegalStateException("render failed");
        UnhandledExceptionEvent event = new UnhandledExceptionEvent(failure);
        
        coordinator.onUnhandledException(event);
        
        assertTrue(event.isHandled());
        verify(coreModel).logError("Unhandled exception");
        verify(coreModel).logError("render failed");
        verify(telemetry).logException(failure);
        verify(telemetry).notifyCrash();
        verify(coreModel).markCrashing();
        
        ArgumentCaptor<String> details = ArgumentCaptor.forClass(String.class);
        verify(coreModel).requestCrashPrompt(details.capture());
        assertTrue(details.getValue().startsWith("render failed"));
        assertTrue(details.getValue().contains("IllegalStateException"));
        
        assertEquals(1, viewModel.exitCount());
        assertEquals(Boolean.FALSE, viewModel.lastAllowCancellation());
        assertTrue(control.isEnabled());
        assertEquals(CrashPhase.CRASHED, coordinator.getPhase());
    }
    
    @Test
    @DisplayName("Only the first crash of a session is processed")
    void testSecondCrashIsIgnored() {
        FakeViewModel viewModel = attachSession();
        
        coordinator.onUnhandledException(new UnhandledExceptionEvent(new RuntimeException("one")));
        control.setEnabled(false);
        UnhandledExceptionEvent second = new UnhandledExceptionEvent(new RuntimeException("two"));
        coordinator.onUnhandledException(second);
        
        assertTrue(second.isHandled());
        verify(telemetry, times(1)).notifyCrash();
        verify(coreModel, times(1)).requestCrashPrompt(anyString());
        assertEquals(1, viewModel.exitCount());
        assertTrue(control.isEnabled());
    }
    
    @Test
    void testFailingStepsDoNotStopSequence() {
        FakeViewModel viewModel = attachSession();
        doThrow(new RuntimeException("telemetry down")).when(telemetry).logException(any());
        doThrow(new RuntimeException("no log")).when(coreModel).logError(anyString());
        
        UnhandledExceptionEvent event = new UnhandledExceptionEvent(new RuntimeException("boom"));
        assertDoesNotThrow(() -> coordinator.onUnhandledException(event));
        
        assertTrue(event.isHandled());
        verify(coreModel).requestCrashPrompt(anyString());
        assertEquals(1, viewModel.exitCount());
        assertTrue(control.isEnabled());
    }
    
    @Test
    void testCrashWithoutSessionOnlyReenablesControl() {
        UnhandledExceptionEvent event = new UnhandledExceptionEvent(new RuntimeException("orphan"));
        
        coordinator.onUnhandledException(event);
        
        assertTrue(event.isHandled());
        assertTrue(control.isEnabled());
        verifyNoInteractions(telemetry);
        assertEquals(CrashPhase.IDLE, coordinator.getPhase());
    }
    
    @Test
    void testStackTraceOmittedWhenDisabled() {
        coordinator = new CrashRecoveryCoordinator(sessions, telemetry, control, false);
        attachSession();
        
        coordinator.onUnhandledException(new UnhandledExceptionEvent(new RuntimeException("short")));
        
        verify(coreModel).requestCrashPrompt("short");
    }
    
    @Test
    void testMessageFallsBackToExceptionType() {
        attachSession();
        
        coordinator.onUnhandledException(new UnhandledExceptionEvent(new NullPointerException()));
        
        verify(coreModel).logError("java.lang.NullPointerException");
    }
    
    @Test
    void testNewSessionAfterCrashIsRecovered() {
        attachSession();
        coordinator.onUnhandledException(new UnhandledExceptionEvent(new RuntimeException("boom")));
        sessions.detach();
        
        FakeViewModel next = attachSession();
        
        assertEquals(CrashPhase.RECOVERED, coordinator.getPhase());
        
        coordinator.onUnhandledException(new UnhandledExceptionEvent(new RuntimeException("again")));
        assertEquals(1, next.exitCount());
        assertEquals(CrashPhase.CRASHED, coordinator.getPhase());
    }
}
