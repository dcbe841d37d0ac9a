package com.atrium.ids;

/**
 * Thrown when a scene has handed out every 32-bit local id.
 */
public class LocalIdExhaustedException extends IllegalStateException {
    
    public LocalIdExhaustedException(long lastAllocated) {
        super("Local id space exhausted at " + lastAllocated);
    }
}
