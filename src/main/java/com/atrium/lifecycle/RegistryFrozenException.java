package com.atrium.lifecycle;

/**
 * Thrown when attempting to register after a registry is frozen.
 */
public class RegistryFrozenException extends SceneRegistrationException {
    
    public RegistryFrozenException(String registryName) {
        super(registryName + " is frozen - no further registrations allowed");
    }
}
