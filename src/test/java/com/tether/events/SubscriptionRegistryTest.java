package com.tether.events;

import com.tether.host.FakeHostApplication;
import com.tether.host.HostEvent;
import com.tether.host.HostEventArgs;
import com.tether.host.HostEventHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {
    
    private FakeHostApplication host;
    private SubscriptionRegistry registry;
    private AtomicInteger calls;
    private ApplicationEventHandlers handlers;
    
    @BeforeEach
    void setUp() {
        host = new FakeHostApplication();
        registry = new SubscriptionRegistry(host);
        calls = new AtomicInteger();
        
        Map<HostEvent, HostEventHandler> map = new EnumMap<>(HostEvent.class);
        for (HostEvent event : HostEvent.values()) {
            map.put(event, args -> calls.incrementAndGet());
        }
        handlers = ApplicationEventHandlers.of(map);
    }
    
    @Test
    void testSubscribeAttachesEveryKind() {
        registry.subscribe(handlers);
        
        for (HostEvent event : HostEvent.values()) {
            assertTrue(registry.isActive(event));
            assertEquals(1, host.handlerCount(event));
        }
        assertTrue(registry.isSubscribed());
    }
    
    @Test
    @DisplayName("Subscribing twice keeps one handler per kind")
    void testSubscribeTwiceDoesNotDuplicate() {
        registry.subscribe(handlers);
        registry.subscribe(handlers);
        
        for (HostEvent event : HostEvent.values()) {
            assertEquals(1, registry.activeCount(event));
            assertEquals(1, host.handlerCount(event));
        }
        
        host.fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_OPENED, "doc-1"));
        assertEquals(1, calls.get());
    }
    
    @Test
    void testSubscribeTwiceUnsubscribeOnceLeavesNothingAttached() {
        registry.subscribe(handlers);
        registry.subscribe(handlers);
        registry.unsubscribe(handlers);
        
        for (HostEvent event : HostEvent.values()) {
            assertFalse(registry.isActive(event));
            assertEquals(0, host.handlerCount(event));
        }
        
        host.fire(HostEventArgs.forView(HostEvent.VIEW_ACTIVATED, "view-1"));
        assertEquals(0, calls.get());
        assertFalse(registry.isSubscribed());
    }
    
    @Test
    void testUnsubscribeWhenInactiveIsNoOp() {
        assertDoesNotThrow(() -> registry.unsubscribe(handlers));
        assertFalse(registry.remove(HostEvent.DOCUMENT_CLOSED));
    }
    
    @Test
    void testResubscribeAfterUnsubscribe() {
        registry.subscribe(handlers);
        registry.unsubscribe(handlers);
        registry.subscribe(handlers);
        
        assertTrue(registry.isSubscribed());
        host.fire(HostEventArgs.forDocument(HostEvent.DOCUMENT_CLOSING, "doc-1"));
        assertEquals(1, calls.get());
    }
    
    @Test
    void testAddIsPerKind() {
        HostEventHandler first = args -> calls.incrementAndGet();
        HostEventHandler second = args -> calls.addAndGet(100);
        
        assertTrue(registry.add(HostEvent.VIEW_ACTIVATING, first));
        assertFalse(registry.add(HostEvent.VIEW_ACTIVATING, second));
        
        host.fire(HostEventArgs.forView(HostEvent.VIEW_ACTIVATING, "view-1"));
        assertEquals(1, calls.get());
        assertFalse(registry.isActive(HostEvent.VIEW_ACTIVATED));
        assertFalse(registry.isSubscribed());
    }
    
    @Test
    void testPartialSetOnlyTouchesItsKinds() {
        registry.subscribe(handlers);
        
        Map<HostEvent, HostEventHandler> viewOnly = new EnumMap<>(HostEvent.class);
        viewOnly.put(HostEvent.VIEW_ACTIVATED, args -> { });
        registry.unsubscribe(ApplicationEventHandlers.of(viewOnly));
        
        assertFalse(registry.isActive(HostEvent.VIEW_ACTIVATED));
        assertTrue(registry.isActive(HostEvent.DOCUMENT_OPENED));
    }
    
    @Test
    void testNullHandlerRejected() {
        assertThrows(NullPointerException.class, () -> registry.add(HostEvent.DOCUMENT_OPENED, null));
    }
}
