package com.atrium.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing table from commander and command names to their handlers.
 * 
 * Command names form one flat namespace across all commanders of a scene.
 * The first commander to register a name owns it.
 * 
 * Lock order: {@code moduleCommanders} is always taken before {@code moduleCommands}.
 */
public class CommandRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRegistry.class);
    
    private final Map<String, Commander> moduleCommanders = new LinkedHashMap<>();
    private final Map<String, Command> moduleCommands = new HashMap<>();
    private final Map<String, String> commandOwners = new HashMap<>();
    
    /**
     * Registers a commander and all of its commands.
     * 
     * A command whose name is already taken by another commander is logged
     * and skipped. The rest of the commander's commands are still registered.
     * 
     * @param commander the commander to register
     * @return the number of commands actually registered
     */
    public int registerModuleCommander(Commander commander) {
        String commanderName = commander.getName();
        
        synchronized (moduleCommanders) {
            if (moduleCommanders.containsKey(commanderName)) {
                LOGGER.error("Module commander {} is already registered, ignoring the new commander and its {} commands",
                    commanderName, commander.getCommands().size());
                return 0;
            }
            
            moduleCommanders.put(commanderName, commander);
            
            int registered = 0;
            synchronized (moduleCommands) {
                for (Command command : commander.getCommands().values()) {
                    String commandName = command.name();
                    if (moduleCommands.containsKey(commandName)) {
                        LOGGER.error(
                            "Module commander {} tried to register the command {} which has already been registered by {}",
                            commanderName, commandName, commandOwners.get(commandName));
                        continue;
                    }
                    
                    moduleCommands.put(commandName, command);
                    commandOwners.put(commandName, commanderName);
                    registered++;
                }
            }
            
            LOGGER.debug("Registered module commander {} with {} of {} commands",
                commanderName, registered, commander.getCommands().size());
            return registered;
        }
    }
    
    /**
     * Gets a module command.
     * 
     * @param commandName the command name
     * @return the command, or null if no command is registered with that name
     */
    public Command getCommand(String commandName) {
        synchronized (moduleCommands) {
            return moduleCommands.get(commandName);
        }
    }
    
    /**
     * Gets the name of the commander that owns a command.
     * 
     * @param commandName the command name
     * @return the owning commander's name, or null if the command is not registered
     */
    public String getCommandOwner(String commandName) {
        synchronized (moduleCommands) {
            return commandOwners.get(commandName);
        }
    }
    
    /**
     * Gets a module commander.
     * 
     * @param name the commander name
     * @return the commander, or null if no commander with that name was found
     */
    public Commander getCommander(String name) {
        synchronized (moduleCommanders) {
            return moduleCommanders.get(name);
        }
    }
    
    /**
     * Gets the live commander map.
     * 
     * This is the registry's own backing map, not a copy. Callers iterating it
     * while other threads register commanders must synchronize on the returned map.
     * 
     * @return the commander name to commander map
     */
    public Map<String, Commander> getCommanders() {
        return moduleCommanders;
    }
}
