package com.atrium.commands;

/**
 * Action run when a module command is invoked.
 */
@FunctionalInterface
public interface CommandCallback {
    
    /**
     * @param moduleName the name of the module the command was routed to
     * @param args the command words, the command name first
     */
    void run(String moduleName, String[] args);
}
