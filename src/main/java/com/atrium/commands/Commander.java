package com.atrium.commands;

import java.util.Map;

/**
 * A named group of related commands, usually owned by one region module.
 */
public interface Commander {
    
    /**
     * The commander's unique name.
     */
    String getName();
    
    /**
     * The commands owned by this commander, keyed by command name.
     */
    Map<String, Command> getCommands();
}
