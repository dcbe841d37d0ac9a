package com.atrium.scene;

import com.atrium.capabilities.CreationCode;
import com.atrium.capabilities.EntityCreator;
import com.atrium.capabilities.InterfaceRegistry;
import com.atrium.commands.Command;
import com.atrium.commands.CommandCallback;
import com.atrium.commands.CommandRegistry;
import com.atrium.commands.CommandSink;
import com.atrium.commands.Commander;
import com.atrium.commands.InvalidModuleArgumentException;
import com.atrium.config.SceneConfig;
import com.atrium.events.SceneEventManager;
import com.atrium.ids.LocalIdAllocator;
import com.atrium.lifecycle.LifecycleController;
import com.atrium.lifecycle.PhaseController;
import com.atrium.lifecycle.ScenePhase;
import com.atrium.modules.ModuleRegistry;
import com.atrium.modules.RegionModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A running region scene.
 * 
 * Owns the module, capability and command registries and the local id
 * allocator, and delegates world behavior to a pluggable {@link SceneBehavior}.
 * Instances are produced by {@link SceneBuilder}; once built, the module and
 * capability sets are fixed and every method is safe to call from any thread.
 */
public class Scene {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Scene.class);
    
    private final SceneConfig config;
    private final RegionInfo regionInfo;
    private final PhaseController phaseController;
    private final ModuleRegistry modules;
    private final InterfaceRegistry interfaces;
    private final CommandRegistry commands;
    private final LocalIdAllocator localIds;
    private final SceneEventManager eventManager;
    private final LifecycleController lifecycle;
    private final SceneBehavior behavior;
    private final TerrainChannel terrain;
    private final CommandSink commandSink;
    
    private volatile RegionStatus regionStatus = RegionStatus.UP;
    
    Scene(SceneConfig config,
          RegionInfo regionInfo,
          PhaseController phaseController,
          ModuleRegistry modules,
          InterfaceRegistry interfaces,
          CommandRegistry commands,
          SceneEventManager eventManager,
          SceneBehavior behavior,
          TerrainChannel terrain,
          CommandSink commandSink) {
        this.config = config;
        this.regionInfo = regionInfo;
        this.phaseController = phaseController;
        this.modules = modules;
        this.interfaces = interfaces;
        this.commands = commands;
        this.localIds = new LocalIdAllocator(config.localIdSeed());
        this.eventManager = eventManager;
        this.lifecycle = new LifecycleController(regionInfo, modules, eventManager, phaseController);
        this.behavior = behavior;
        this.terrain = terrain;
        this.commandSink = commandSink;
    }
    
    public RegionInfo getRegionInfo() {
        return regionInfo;
    }
    
    public SceneConfig getConfig() {
        return config;
    }
    
    public ScenePhase getPhase() {
        return phaseController.getCurrentPhase();
    }
    
    public SceneEventManager getEventManager() {
        return eventManager;
    }
    
    public RegionStatus getRegionStatus() {
        return regionStatus;
    }
    
    public void setRegionStatus(RegionStatus regionStatus) {
        this.regionStatus = regionStatus;
    }
    
    public String getSimulatorVersion() {
        return config.simulatorVersion();
    }
    
    // Local ids
    
    /**
     * Returns a new unallocated local id.
     * 
     * @return a brand new local id
     */
    public long allocateLocalId() {
        return localIds.allocateLocalId();
    }
    
    // Modules
    
    /**
     * All the region modules attached to this scene.
     */
    public Map<String, RegionModule> getModules() {
        return modules.getModules();
    }
    
    public RegionModule getModule(String name) {
        return modules.getModule(name);
    }
    
    // Capabilities
    
    /**
     * For the given capability, retrieves the region module which implements it.
     * 
     * @return null if no registered module implements that capability
     */
    public <T> T requestModuleInterface(Class<T> type) {
        return interfaces.requestModuleInterface(type);
    }
    
    /**
     * For the given capability, retrieves every region module that implements it.
     * 
     * @return the implementers in registration order, or a single null element if there are none
     */
    public <T> List<T> requestModuleInterfaces(Class<T> type) {
        return interfaces.requestModuleInterfaces(type);
    }
    
    public boolean hasModuleInterface(Class<?> type) {
        return interfaces.hasModuleInterface(type);
    }
    
    /**
     * @return the module that creates objects of this kind, or null if there is none
     */
    public EntityCreator getEntityCreator(CreationCode code) {
        return interfaces.getEntityCreators().creatorFor(code);
    }
    
    // Commands
    
    public int registerModuleCommander(Commander commander) {
        return commands.registerModuleCommander(commander);
    }
    
    public Command getCommand(String commandName) {
        return commands.getCommand(commandName);
    }
    
    public Commander getCommander(String name) {
        return commands.getCommander(name);
    }
    
    /**
     * @return the live commander map; see {@link CommandRegistry#getCommanders()}
     */
    public Map<String, Commander> getCommanders() {
        return commands.getCommanders();
    }
    
    /**
     * Publishes a command on the host console on behalf of a module.
     * 
     * Does nothing when the scene has no console.
     * 
     * @param module the owning {@link RegionModule}, or null for a command owned by no module
     * @throws InvalidModuleArgumentException if {@code module} is not a region module
     */
    public void addCommand(Object module, String command, String shortHelp, String longHelp, CommandCallback callback) {
        if (commandSink == null) {
            return;
        }
        
        String moduleName = "";
        boolean shared = false;
        
        if (module != null) {
            if (!(module instanceof RegionModule)) {
                throw new InvalidModuleArgumentException(module);
            }
            RegionModule regionModule = (RegionModule) module;
            moduleName = regionModule.getName();
            shared = regionModule.isSharedModule();
        }
        
        commandSink.addCommand(moduleName, shared, command, shortHelp, longHelp, callback);
    }
    
    // Lifecycle
    
    /**
     * Tidies the scene before shutdown. See {@link LifecycleController#close()}.
     */
    public void close() {
        regionStatus = RegionStatus.SHUTTING_DOWN;
        lifecycle.close();
        regionStatus = RegionStatus.DOWN;
    }
    
    /**
     * Region restart.
     * 
     * @param seconds seconds till restart
     */
    public void restart(int seconds) {
        lifecycle.restart(seconds);
    }
    
    public List<String> show(String... showParams) {
        return lifecycle.show(showParams);
    }
    
    // World behavior
    
    public void update() {
        behavior.update();
    }
    
    public void loadWorldMap() {
        behavior.loadWorldMap();
    }
    
    public void addNewClient(ClientView client) {
        behavior.addNewClient(client);
    }
    
    public void removeClient(UUID agentId) {
        behavior.removeClient(agentId);
    }
    
    public void closeAllAgents(long circuitCode) {
        behavior.closeAllAgents(circuitCode);
    }
    
    public boolean otherRegionUp(RegionInfo otherRegion) {
        return behavior.otherRegionUp(otherRegion);
    }
    
    public boolean presenceChildStatus(UUID avatarId) {
        return behavior.presenceChildStatus(avatarId);
    }
    
    /**
     * Sends the region heightmap to a client.
     * 
     * @throws IllegalStateException if the scene has no terrain
     */
    public void sendLayerData(ClientView client) {
        if (terrain == null) {
            throw new IllegalStateException("Scene '" + regionInfo.regionName() + "' has no terrain channel");
        }
        client.sendLayerData(terrain.getFloatsSerialised());
        LOGGER.debug("Sent layer data for '{}' to {}", regionInfo.regionName(), client.getAgentId());
    }
}
