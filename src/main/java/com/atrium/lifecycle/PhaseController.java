package com.atrium.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the lifecycle phase of a single scene.
 * 
 * This is the single source of truth for the scene's current phase.
 * All phase transitions must go through this controller.
 */
public class PhaseController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PhaseController.class);
    
    private final String sceneName;
    private final AtomicReference<ScenePhase> currentPhase;
    
    public PhaseController(String sceneName) {
        this.sceneName = sceneName;
        this.currentPhase = new AtomicReference<>(ScenePhase.SETUP);
        LOGGER.debug("PhaseController for scene '{}' initialized in SETUP phase", sceneName);
    }
    
    /**
     * Gets the current phase.
     * 
     * @return the current ScenePhase
     */
    public ScenePhase getCurrentPhase() {
        return currentPhase.get();
    }
    
    /**
     * Advances to a later phase.
     * 
     * @param nextPhase the phase to advance to
     * @throws IllegalStateException if the transition goes backwards or races another transition
     */
    public void advanceTo(ScenePhase nextPhase) {
        ScenePhase current = getCurrentPhase();
        
        if (nextPhase == current) {
            LOGGER.warn("Scene '{}' attempted to advance to the same phase: {}", sceneName, nextPhase);
            return;
        }
        
        if (!nextPhase.isAfter(current)) {
            String errorMsg = String.format(
                "Invalid phase transition for scene '%s': %s -> %s. Phases must advance monotonically.",
                sceneName, current, nextPhase
            );
            LOGGER.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }
        
        if (currentPhase.compareAndSet(current, nextPhase)) {
            LOGGER.info("Scene '{}' phase transition: {} -> {}", sceneName, current, nextPhase);
        } else {
            // CAS failed, meaning another thread changed the phase
            throw new IllegalStateException(
                String.format("Concurrent phase modification detected on scene '%s'. Expected %s, but was %s",
                    sceneName, current, getCurrentPhase())
            );
        }
    }
}
