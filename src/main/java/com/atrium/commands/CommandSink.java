package com.atrium.commands;

/**
 * The host console that module commands are published to.
 */
public interface CommandSink {
    
    /**
     * Publishes a command on the console.
     * 
     * @param moduleName the owning module's name, empty when not owned by a module
     * @param shared whether the owning module is shared across scenes
     * @param command the command name
     * @param shortHelp one-line usage
     * @param longHelp full description
     * @param callback the action to run
     */
    void addCommand(String moduleName, boolean shared, String command, String shortHelp, String longHelp,
                    CommandCallback callback);
}
