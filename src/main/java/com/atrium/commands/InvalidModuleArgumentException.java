package com.atrium.commands;

/**
 * Thrown when a command is published on behalf of an object that is not a region module.
 */
public class InvalidModuleArgumentException extends IllegalArgumentException {
    
    public InvalidModuleArgumentException(Object argument) {
        super("addCommand module parameter must be a RegionModule, got " + argument.getClass().getName());
    }
}
