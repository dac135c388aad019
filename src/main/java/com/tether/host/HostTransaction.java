package com.tether.host;

/**
 * A transaction scope opened on a {@link HostDocument}.
 * 
 * Closing a transaction that was neither committed nor rolled back rolls it back.
 */
public interface HostTransaction extends AutoCloseable {
    
    void commit();
    
    void rollback();
    
    boolean isOpen();
    
    @Override
    void close();
}
