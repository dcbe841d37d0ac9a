package com.atrium.events;

/**
 * Notified once a scene has torn down its modules.
 */
@FunctionalInterface
public interface ShutdownListener {
    
    void onShutdown();
}
