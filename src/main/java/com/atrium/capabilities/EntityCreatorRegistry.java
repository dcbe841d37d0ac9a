package com.atrium.capabilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Index from creation code to the module that creates objects of that kind.
 * 
 * Fed by {@link InterfaceRegistry} whenever a registered capability instance
 * is also an {@link EntityCreator}. The latest creator for a code wins.
 */
public class EntityCreatorRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(EntityCreatorRegistry.class);
    
    private final Map<CreationCode, EntityCreator> creators = new ConcurrentHashMap<>();
    
    /**
     * Points every creation code the creator supports at it, replacing earlier creators.
     */
    void register(EntityCreator creator) {
        for (CreationCode code : creator.getCreationCapabilities()) {
            EntityCreator previous = creators.put(code, creator);
            if (previous != null && previous != creator) {
                LOGGER.debug("Entity creator for {} replaced: {} -> {}",
                    code, previous.getClass().getSimpleName(), creator.getClass().getSimpleName());
            } else {
                LOGGER.debug("Entity creator for {} set to {}", code, creator.getClass().getSimpleName());
            }
        }
    }
    
    /**
     * Gets the creator responsible for a creation code.
     * 
     * @param code the creation code
     * @return the creator, or null if no module creates this kind of object
     */
    public EntityCreator creatorFor(CreationCode code) {
        return creators.get(code);
    }
    
    /**
     * Gets a snapshot of all creators.
     * 
     * @return immutable map of creation code to creator
     */
    public Map<CreationCode, EntityCreator> getCreators() {
        if (creators.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(creators));
    }
}
