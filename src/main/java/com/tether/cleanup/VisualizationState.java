package com.tether.cleanup;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The part of the visualization layer's state Tether cleans up: the id of the
 * marker element kept in the host document.
 */
public final class VisualizationState {
    
    private final AtomicReference<MarkerId> marker = new AtomicReference<>(MarkerId.INVALID);
    
    /**
     * Records the marker created by the visualization layer.
     */
    public void setMarker(MarkerId markerId) {
        marker.set(Objects.requireNonNull(markerId, "markerId"));
    }
    
    public MarkerId markerId() {
        return marker.get();
    }
    
    /**
     * Takes the marker for deletion, leaving {@link MarkerId#INVALID} behind.
     * 
     * @return the marker that was held, or INVALID if none
     */
    public MarkerId claimMarker() {
        return marker.getAndSet(MarkerId.INVALID);
    }
}
