package com.tether.events;

import com.tether.host.HostEvent;
import com.tether.host.HostEventHandler;
import com.tether.model.CoreModel;
import com.tether.session.SessionManager;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One handler per host event kind, as handed to {@link SubscriptionRegistry}.
 */
public final class ApplicationEventHandlers {
    
    private final Map<HostEvent, HostEventHandler> handlers;
    
    private ApplicationEventHandlers(Map<HostEvent, HostEventHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }
    
    public static ApplicationEventHandlers of(Map<HostEvent, HostEventHandler> handlers) {
        if (handlers.isEmpty()) {
            return new ApplicationEventHandlers(new EnumMap<>(HostEvent.class));
        }
        return new ApplicationEventHandlers(handlers);
    }
    
    /**
     * Builds the standard handler set: every host event is forwarded to the
     * core model of the live session, and ignored while no session is attached.
     * 
     * @param sessions source of the live session
     * @return handlers for all {@link HostEvent} kinds
     */
    public static ApplicationEventHandlers forwardingTo(SessionManager sessions) {
        Map<HostEvent, HostEventHandler> map = new EnumMap<>(HostEvent.class);
        map.put(HostEvent.VIEW_ACTIVATING, args -> core(sessions)
            .ifPresent(core -> core.setRunEnabledForView(args.viewId())));
        map.put(HostEvent.VIEW_ACTIVATED, args -> core(sessions)
            .ifPresent(CoreModel::handleViewActivated));
        map.put(HostEvent.DOCUMENT_OPENED, args -> core(sessions)
            .ifPresent(CoreModel::handleDocumentOpened));
        map.put(HostEvent.DOCUMENT_CLOSING, args -> core(sessions)
            .ifPresent(core -> core.handleDocumentClosing(args.documentId())));
        map.put(HostEvent.DOCUMENT_CLOSED, args -> core(sessions)
            .ifPresent(CoreModel::handleDocumentClosed));
        return new ApplicationEventHandlers(map);
    }
    
    private static Optional<CoreModel> core(SessionManager sessions) {
        return sessions.current().map(session -> session.coreModel());
    }
    
    public Set<HostEvent> events() {
        return handlers.keySet();
    }
    
    public HostEventHandler get(HostEvent event) {
        return handlers.get(event);
    }
}
