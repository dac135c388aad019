package com.tether.events;

import com.tether.host.FakeHostApplication;
import com.tether.host.HostEvent;
import com.tether.host.HostEventArgs;
import com.tether.lifecycle.InitializationGate;
import com.tether.model.CoreModel;
import com.tether.session.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ApplicationEventHandlersTest {
    
    @Mock
    private CoreModel coreModel;
    
    private SessionManager sessions;
    private ApplicationEventHandlers handlers;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        sessions = new SessionManager(new InitializationGate(context -> null),
            new SubscriptionRegistry(new FakeHostApplication()));
        handlers = ApplicationEventHandlers.forwardingTo(sessions);
    }
    
    private void fire(HostEventArgs args) {
        handlers.get(args.event()).handle(args);
    }
    
    @Test
    void testCoversEveryEventKind() {
        for (HostEvent event : HostEvent.values()) {
            assertNotNull(handlers.get(event), event.name());
        }
    }
    
    @Test
    void testEventsIgnoredWithoutSession() {
        assertDoesNotThrow(() -> fire(
            HostEventArgs.forDocument(HostEvent.DOCUMENT_OPENED, "doc-1")));
        verifyNoInteractions(coreModel);
    }
    
    @Test
    void testEventsForwardedToLiveCore() {
        sessions.attach(coreModel);
        
        fire(HostEventArgs.forView(HostEvent.VIEW_ACTIVATING, "view-7"));
        fire(HostEventArgs.forView(HostEvent.VIEW_ACTIVATED, "view-7"));
        fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_OPENED, "doc-1"));
        fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_CLOSING, "doc-1"));
        fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_CLOSED, "doc-1"));
        
        verify(coreModel).setRunEnabledForView("view-7");
        verify(coreModel).handleViewActivated();
        verify(coreModel).handleDocumentOpened();
        verify(coreModel).handleDocumentClosing("doc-1");
        verify(coreModel).handleDocumentClosed();
    }
    
    @Test
    void testEventsStopAfterDetach() {
        sessions.attach(coreModel);
        sessions.detach();
        
        fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_CLOSED, "doc-1"));
        
        verifyNoInteractions(coreModel);
    }
}
