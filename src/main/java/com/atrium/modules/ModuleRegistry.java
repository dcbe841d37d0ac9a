package com.atrium.modules;

import com.atrium.lifecycle.RegistryFrozenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The region modules attached to one scene, keyed by name.
 * 
 * Written only while the scene is being set up; frozen before the scene
 * starts serving. Tearing down the modules is the only mutation allowed
 * after the freeze.
 */
public class ModuleRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleRegistry.class);
    
    private final Map<String, RegionModule> modules = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile boolean frozen = false;
    
    /**
     * Adds a module under the given name.
     * 
     * If a module is already registered under this name the call is ignored:
     * the existing module is kept and no error is raised.
     * 
     * @param name the module name
     * @param module the module
     * @throws RegistryFrozenException if the registry is frozen
     */
    public void addModule(String name, RegionModule module) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(module, "module");
        
        if (frozen) {
            throw new RegistryFrozenException("Module registry");
        }
        
        RegionModule existing = modules.putIfAbsent(name, module);
        if (existing == null) {
            LOGGER.debug("Added module '{}' (shared: {})", name, module.isSharedModule());
        } else if (existing != module) {
            LOGGER.debug("Module name '{}' already taken, keeping the existing module", name);
        }
    }
    
    /**
     * Gets a module by name.
     * 
     * @param name the module name
     * @return the module, or null if none is registered under that name
     */
    public RegionModule getModule(String name) {
        return modules.get(name);
    }
    
    /**
     * Gets all attached modules.
     * 
     * @return read-only view of module name to module, in insertion order
     */
    public Map<String, RegionModule> getModules() {
        return Collections.unmodifiableMap(modules);
    }
    
    public int size() {
        return modules.size();
    }
    
    /**
     * Closes every non-shared module, then empties the registry.
     * 
     * A module whose close hook throws is logged and skipped; the remaining
     * modules are still closed and the registry is always cleared, shared
     * entries included.
     * 
     * @return the number of close hooks that failed
     */
    public int closeModules() {
        List<RegionModule> snapshot;
        synchronized (modules) {
            snapshot = new ArrayList<>(modules.values());
        }
        
        int failures = 0;
        try {
            for (RegionModule module : snapshot) {
                if (module.isSharedModule()) {
                    continue;
                }
                
                try {
                    module.close();
                    LOGGER.debug("Closed module '{}'", module.getName());
                } catch (Exception e) {
                    failures++;
                    LOGGER.error("Module '{}' failed to close", module.getName(), e);
                }
            }
        } finally {
            modules.clear();
        }
        
        if (failures > 0) {
            LOGGER.warn("Closed {} modules with {} failures", snapshot.size(), failures);
        }
        return failures;
    }
    
    /**
     * Freezes the registry - no further modules may be added.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        
        LOGGER.debug("Freezing module registry with {} modules", modules.size());
        this.frozen = true;
    }
    
    public boolean isFrozen() {
        return frozen;
    }
}
