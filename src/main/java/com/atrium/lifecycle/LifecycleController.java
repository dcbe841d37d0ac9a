package com.atrium.lifecycle;

import com.atrium.events.SceneEventManager;
import com.atrium.modules.ModuleRegistry;
import com.atrium.modules.RegionModule;
import com.atrium.scene.RegionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives shutdown, restart requests and diagnostics for one scene.
 */
public class LifecycleController {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleController.class);
    
    public static final String SHOW_MODULES = "modules";
    
    private final RegionInfo regionInfo;
    private final ModuleRegistry modules;
    private final SceneEventManager eventManager;
    private final PhaseController phaseController;
    private final AtomicBoolean closing = new AtomicBoolean(false);
    
    public LifecycleController(RegionInfo regionInfo, ModuleRegistry modules,
                               SceneEventManager eventManager, PhaseController phaseController) {
        this.regionInfo = regionInfo;
        this.modules = modules;
        this.eventManager = eventManager;
        this.phaseController = phaseController;
    }
    
    /**
     * Tidies the scene before shutdown.
     * 
     * Closes every non-shared module, empties the module registry and then
     * signals shutdown to the event manager. Nothing thrown along the way
     * reaches the caller.
     */
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            LOGGER.warn("Scene '{}' is already closed", regionInfo.regionName());
            return;
        }
        
        LOGGER.info("Closing scene '{}' with {} modules", regionInfo.regionName(), modules.size());
        
        modules.closeModules();
        
        try {
            eventManager.triggerShutdown();
        } catch (Exception e) {
            LOGGER.error("Scene '{}' shutdown notification failed", regionInfo.regionName(), e);
        }
        
        phaseController.advanceTo(ScenePhase.CLOSED);
    }
    
    /**
     * Passes a restart request up to the host.
     * 
     * @param secondsUntilRestart seconds until the region restarts
     * @return the number of restart listeners notified
     */
    public int restart(int secondsUntilRestart) {
        LOGGER.info("Region '{}' requesting restart in {} seconds", regionInfo.regionName(), secondsUntilRestart);
        return eventManager.triggerRestart(regionInfo);
    }
    
    /**
     * Shows details about the scene.
     * 
     * Only the {@value #SHOW_MODULES} topic is recognised; it lists the
     * non-shared modules attached to the scene. Other topics show nothing.
     * 
     * @param showParams what to show, topic first
     * @return the lines shown, empty for an unrecognised topic
     */
    public List<String> show(String... showParams) {
        if (showParams == null || showParams.length == 0) {
            return Collections.emptyList();
        }
        
        if (!SHOW_MODULES.equals(showParams[0])) {
            LOGGER.debug("Nothing to show for topic '{}'", showParams[0]);
            return Collections.emptyList();
        }
        
        List<String> lines = new ArrayList<>();
        lines.add("The currently loaded modules in " + regionInfo.regionName() + " are:");
        for (RegionModule module : List.copyOf(modules.getModules().values())) {
            if (!module.isSharedModule()) {
                lines.add("Region Module: " + module.getName());
            }
        }
        
        lines.forEach(LOGGER::info);
        return lines;
    }
}
