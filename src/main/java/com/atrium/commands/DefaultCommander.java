package com.atrium.commands;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Commander backed by an insertion-ordered map.
 */
public class DefaultCommander implements Commander {
    
    private final String name;
    private final Map<String, Command> commands = new LinkedHashMap<>();
    
    public DefaultCommander(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }
    
    /**
     * Adds a command to this commander, replacing any command with the same name.
     * 
     * @return this commander, for chaining
     */
    public DefaultCommander addCommand(Command command) {
        commands.put(command.name(), command);
        return this;
    }
    
    public DefaultCommander addCommand(String commandName, String shortHelp, String longHelp, CommandCallback callback) {
        return addCommand(new Command(commandName, shortHelp, longHelp, callback));
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    @Override
    public Map<String, Command> getCommands() {
        return Collections.unmodifiableMap(commands);
    }
    
    @Override
    public String toString() {
        return "DefaultCommander{" + name + ", commands=" + commands.keySet() + "}";
    }
}
