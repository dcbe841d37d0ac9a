package com.atrium.scene;

import com.atrium.capabilities.EntityCreatorRegistry;
import com.atrium.capabilities.InterfaceRegistry;
import com.atrium.commands.CommandRegistry;
import com.atrium.commands.CommandSink;
import com.atrium.commands.Commander;
import com.atrium.config.SceneConfig;
import com.atrium.events.SceneEventManager;
import com.atrium.lifecycle.PhaseController;
import com.atrium.lifecycle.ScenePhase;
import com.atrium.modules.ModuleRegistry;
import com.atrium.modules.RegionModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Assembles a {@link Scene}.
 * 
 * All module and capability registration happens here, on one thread, before
 * the scene exists. {@link #build()} freezes the registries and hands the
 * scene out; a builder cannot be used again afterwards.
 */
public class SceneBuilder {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneBuilder.class);
    
    private final SceneConfig config;
    private final ModuleRegistry modules = new ModuleRegistry();
    private final InterfaceRegistry interfaces = new InterfaceRegistry(new EntityCreatorRegistry());
    private final CommandRegistry commands = new CommandRegistry();
    
    private RegionInfo regionInfo;
    private SceneEventManager eventManager = new SceneEventManager();
    private SceneBehavior behavior;
    private TerrainChannel terrain;
    private CommandSink commandSink;
    private boolean consumed = false;
    
    public SceneBuilder(SceneConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.regionInfo = config.toRegionInfo();
    }
    
    public static SceneBuilder create() {
        return new SceneBuilder(SceneConfig.defaults());
    }
    
    public SceneBuilder regionInfo(RegionInfo regionInfo) {
        ensureNotConsumed();
        this.regionInfo = Objects.requireNonNull(regionInfo, "regionInfo");
        return this;
    }
    
    public SceneBuilder behavior(SceneBehavior behavior) {
        ensureNotConsumed();
        this.behavior = behavior;
        return this;
    }
    
    public SceneBuilder eventManager(SceneEventManager eventManager) {
        ensureNotConsumed();
        this.eventManager = Objects.requireNonNull(eventManager, "eventManager");
        return this;
    }
    
    public SceneBuilder terrain(TerrainChannel terrain) {
        ensureNotConsumed();
        this.terrain = terrain;
        return this;
    }
    
    public SceneBuilder commandSink(CommandSink commandSink) {
        ensureNotConsumed();
        this.commandSink = commandSink;
        return this;
    }
    
    /**
     * Adds a module to the scene. A name that is already taken is ignored.
     */
    public SceneBuilder addModule(String name, RegionModule module) {
        ensureNotConsumed();
        modules.addModule(name, module);
        return this;
    }
    
    /**
     * Registers an interface to a region module. If a module is already
     * registered for this interface it is not replaced.
     */
    public <M> SceneBuilder registerModuleInterface(Class<M> type, M module) {
        ensureNotConsumed();
        interfaces.registerModuleInterface(type, module);
        return this;
    }
    
    /**
     * Adds a region module to the implementers of an interface.
     */
    public <M> SceneBuilder stackModuleInterface(Class<M> type, M module) {
        ensureNotConsumed();
        interfaces.stackModuleInterface(type, module);
        return this;
    }
    
    public SceneBuilder registerModuleCommander(Commander commander) {
        ensureNotConsumed();
        commands.registerModuleCommander(commander);
        return this;
    }
    
    /**
     * Freezes the registries and returns the running scene.
     * 
     * A build that throws leaves the builder open for another attempt.
     * 
     * @throws IllegalStateException if the builder was already used or no behavior was set
     */
    public Scene build() {
        ensureNotConsumed();
        if (behavior == null) {
            throw new IllegalStateException("Scene '" + regionInfo.regionName() + "' needs a SceneBehavior");
        }
        
        PhaseController phaseController = new PhaseController(regionInfo.regionName());
        Scene scene = new Scene(config, regionInfo, phaseController, modules, interfaces, commands,
            eventManager, behavior, terrain, commandSink);
        
        consumed = true;
        modules.freeze();
        interfaces.freeze();
        phaseController.advanceTo(ScenePhase.RUNNING);
        
        LOGGER.info("Built scene '{}' with {} modules and {} commanders",
            regionInfo.regionName(), modules.size(), commands.getCommanders().size());
        return scene;
    }
    
    private void ensureNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("SceneBuilder for '" + regionInfo.regionName() + "' has already built its scene");
        }
    }
}
