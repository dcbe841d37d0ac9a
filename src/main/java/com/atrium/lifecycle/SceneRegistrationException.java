package com.atrium.lifecycle;

/**
 * Base exception for registrations a scene refuses during setup.
 */
public class SceneRegistrationException extends RuntimeException {
    
    public SceneRegistrationException(String message) {
        super(message);
    }
    
    public SceneRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
