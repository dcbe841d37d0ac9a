package com.atrium.capabilities;

import java.util.Set;

/**
 * Capability of a module that instantiates simulated objects.
 */
public interface EntityCreator {
    
    /**
     * The creation codes this creator is responsible for.
     */
    Set<CreationCode> getCreationCapabilities();
}
