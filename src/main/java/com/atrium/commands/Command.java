package com.atrium.commands;

import java.util.Objects;

/**
 * A named, invokable module command.
 * 
 * @param name command name, unique across all commanders of a scene
 * @param shortHelp one-line usage
 * @param longHelp full description
 * @param callback the action to run
 */
public record Command(String name, String shortHelp, String longHelp, CommandCallback callback) {
    
    public Command {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callback, "callback");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
        shortHelp = shortHelp != null ? shortHelp : "";
        longHelp = longHelp != null ? longHelp : "";
    }
}
