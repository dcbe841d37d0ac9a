package com.atrium.lifecycle;

/**
 * Represents the lifecycle phases of a scene.
 * 
 * Phases advance monotonically and never regress. Only one phase is active at any time.
 */
public enum ScenePhase {
    /**
     * The scene is being assembled.
     * Modules and capability interfaces may only be registered here, from a single thread.
     */
    SETUP,
    
    /**
     * The scene is published and serving concurrent traffic.
     * Module and interface registries are frozen.
     */
    RUNNING,
    
    /**
     * The scene has been closed. Non-shared modules have been torn down.
     */
    CLOSED;
    
    /**
     * Returns true if this phase comes after the given phase.
     * 
     * @param other the phase to compare against
     * @return true if this phase is later in the lifecycle
     */
    public boolean isAfter(ScenePhase other) {
        return this.ordinal() > other.ordinal();
    }
}
