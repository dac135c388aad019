package com.tether.host;

/**
 * Shows a blocking message to the user.
 */
@FunctionalInterface
public interface MessagePresenter {
    
    void showBlocking(String message);
}
