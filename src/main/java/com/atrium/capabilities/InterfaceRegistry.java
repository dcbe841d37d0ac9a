package com.atrium.capabilities;

import com.atrium.lifecycle.RegistryFrozenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps a capability interface to the module instances implementing it.
 * 
 * Written only while the scene is being set up; frozen before the scene
 * starts serving, after which all reads are lock-free.
 */
public class InterfaceRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(InterfaceRegistry.class);
    
    private final Map<Class<?>, List<Object>> moduleInterfaces = new ConcurrentHashMap<>();
    private final EntityCreatorRegistry entityCreators;
    private volatile boolean frozen = false;
    
    public InterfaceRegistry(EntityCreatorRegistry entityCreators) {
        this.entityCreators = entityCreators;
    }
    
    /**
     * Registers the single implementer of a capability.
     * 
     * If an implementer is already registered for this capability the call is
     * ignored and the first registrant stays in place.
     * 
     * @param type the capability interface
     * @param module the implementing instance
     * @throws RegistryFrozenException if the registry is frozen
     * @throws IllegalArgumentException if the instance is null or does not implement the capability
     */
    public <M> void registerModuleInterface(Class<M> type, M module) {
        checkRegistration(type, module);
        
        if (moduleInterfaces.containsKey(type)) {
            LOGGER.debug("Capability {} already has an implementer, ignoring {}",
                type.getSimpleName(), module.getClass().getSimpleName());
            return;
        }
        
        List<Object> implementers = new CopyOnWriteArrayList<>();
        implementers.add(module);
        moduleInterfaces.put(type, implementers);
        
        LOGGER.debug("Registered {} for capability {}", module.getClass().getSimpleName(), type.getSimpleName());
        indexEntityCreator(module);
    }
    
    /**
     * Adds an implementer to a capability's list of implementers.
     * 
     * The same instance is never stacked twice on one capability.
     * 
     * @param type the capability interface
     * @param module the implementing instance
     * @throws RegistryFrozenException if the registry is frozen
     * @throws IllegalArgumentException if the instance is null or does not implement the capability
     */
    public <M> void stackModuleInterface(Class<M> type, M module) {
        checkRegistration(type, module);
        
        List<Object> implementers = moduleInterfaces.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>());
        if (containsInstance(implementers, module)) {
            return;
        }
        
        implementers.add(module);
        
        LOGGER.debug("Stacked {} on capability {} (position {})",
            module.getClass().getSimpleName(), type.getSimpleName(), implementers.size() - 1);
        indexEntityCreator(module);
    }
    
    /**
     * Gets the primary implementer of a capability.
     * 
     * @param type the capability interface
     * @return the first registered implementer, or null if there is none
     */
    public <T> T requestModuleInterface(Class<T> type) {
        List<Object> implementers = moduleInterfaces.get(type);
        if (implementers == null || implementers.isEmpty()) {
            return null;
        }
        return type.cast(implementers.get(0));
    }
    
    /**
     * Gets every implementer of a capability, in registration order.
     * 
     * When nothing implements the capability the result is not empty: it is a
     * single-element list holding {@code null}. Callers iterating the result
     * must skip null entries.
     * 
     * @param type the capability interface
     * @return the implementers, or a list containing one null element
     */
    public <T> List<T> requestModuleInterfaces(Class<T> type) {
        List<Object> implementers = moduleInterfaces.get(type);
        if (implementers == null) {
            return Collections.singletonList(null);
        }
        
        List<T> result = new ArrayList<>(implementers.size());
        for (Object implementer : implementers) {
            result.add(type.cast(implementer));
        }
        return Collections.unmodifiableList(result);
    }
    
    /**
     * Checks whether any module implements the capability.
     */
    public boolean hasModuleInterface(Class<?> type) {
        List<Object> implementers = moduleInterfaces.get(type);
        return implementers != null && !implementers.isEmpty();
    }
    
    public EntityCreatorRegistry getEntityCreators() {
        return entityCreators;
    }
    
    /**
     * Freezes the registry - no further registrations allowed.
     */
    public void freeze() {
        if (frozen) {
            return;
        }
        
        LOGGER.debug("Freezing interface registry with {} capabilities", moduleInterfaces.size());
        this.frozen = true;
    }
    
    public boolean isFrozen() {
        return frozen;
    }
    
    private void checkRegistration(Class<?> type, Object module) {
        if (frozen) {
            throw new RegistryFrozenException("Interface registry");
        }
        if (type == null) {
            throw new IllegalArgumentException("Capability type must not be null");
        }
        if (module == null) {
            throw new IllegalArgumentException("Cannot register null for capability " + type.getName());
        }
        if (!type.isInstance(module)) {
            throw new IllegalArgumentException(
                module.getClass().getName() + " does not implement capability " + type.getName()
            );
        }
    }
    
    private void indexEntityCreator(Object module) {
        if (module instanceof EntityCreator) {
            entityCreators.register((EntityCreator) module);
        }
    }
    
    // Identity comparison: two equal-but-distinct implementers may both be stacked.
    private static boolean containsInstance(List<Object> implementers, Object module) {
        for (Object implementer : implementers) {
            if (implementer == module) {
                return true;
            }
        }
        return false;
    }
}
