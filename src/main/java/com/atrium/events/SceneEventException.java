package com.atrium.events;

/**
 * Thrown when one or more listeners fail while an event is dispatched.
 * The individual failures are attached as suppressed exceptions.
 */
public class SceneEventException extends RuntimeException {
    
    public SceneEventException(String message) {
        super(message);
    }
}
