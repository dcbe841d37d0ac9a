package com.atrium.modules;

/**
 * A pluggable extension attached to a scene.
 * 
 * A module may also implement any number of capability interfaces, which it
 * publishes through the scene's interface registry.
 */
public interface RegionModule {
    
    /**
     * The module's unique name within a scene.
     */
    String getName();
    
    /**
     * Whether this module is shared across scenes.
     * Shared modules are closed by the host that owns them, never by a scene.
     */
    boolean isSharedModule();
    
    /**
     * Releases whatever the module holds for its scene.
     * Invoked once by the scene during shutdown for non-shared modules.
     */
    void close();
}
