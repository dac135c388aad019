package com.tether.host;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory host that records attached handlers the way a real host does:
 * attaching the same handler twice makes it fire twice.
 */
public class FakeHostApplication implements HostApplication {
    
    private final String versionName;
    private final Map<HostEvent, List<HostEventHandler>> handlers = new EnumMap<>(HostEvent.class);
    private final List<Runnable> idleHandlers = new CopyOnWriteArrayList<>();
    private HostDocument activeDocument;
    
    public FakeHostApplication() {
        this("Autodesk Revit Architecture 2015");
    }
    
    public FakeHostApplication(String versionName) {
        this.versionName = versionName;
    }
    
    @Override
    public String versionName() {
        return versionName;
    }
    
    @Override
    public void addEventHandler(HostEvent event, HostEventHandler handler) {
        handlers.computeIfAbsent(event, k -> new ArrayList<>()).add(handler);
    }
    
    @Override
    public void removeEventHandler(HostEvent event, HostEventHandler handler) {
        List<HostEventHandler> list = handlers.get(event);
        if (list != null) {
            list.remove(handler);
        }
    }
    
    @Override
    public void addIdleHandler(Runnable handler) {
        idleHandlers.add(handler);
    }
    
    @Override
    public void removeIdleHandler(Runnable handler) {
        idleHandlers.remove(handler);
    }
    
    @Override
    public Optional<HostDocument> activeDocument() {
        return Optional.ofNullable(activeDocument);
    }
    
    public void setActiveDocument(HostDocument document) {
        this.activeDocument = document;
    }
    
    /**
     * Raises a host event, invoking every attached handler.
     */
    public void fire(HostEventArgs args) {
        for (HostEventHandler handler : List.copyOf(handlers.getOrDefault(args.event(), List.of()))) {
            handler.handle(args);
        }
    }
    
    /**
     * Simulates one idle tick.
     */
    public void idle() {
        for (Runnable handler : idleHandlers) {
            handler.run();
        }
    }
    
    public int handlerCount(HostEvent event) {
        return handlers.getOrDefault(event, List.of()).size();
    }
    
    public int idleHandlerCount() {
        return idleHandlers.size();
    }
}
