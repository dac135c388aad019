package com.tether.host;

import com.tether.cleanup.MarkerId;

/**
 * A host-owned document. Mutations must happen inside a {@link HostTransaction}
 * and only from the host's idle callback.
 */
public interface HostDocument {
    
    String id();
    
    /**
     * Opens a transaction scope on this document.
     * 
     * @param name name shown in the host's undo history
     * @return the open transaction
     */
    HostTransaction startTransaction(String name);
    
    /**
     * Deletes the element identified by the given marker.
     * 
     * @param markerId the element to delete
     * @throws RuntimeException if the host rejects the deletion
     */
    void delete(MarkerId markerId);
}
