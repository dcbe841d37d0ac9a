package com.atrium.scene;

import com.atrium.commands.DefaultCommander;
import com.atrium.config.SceneConfig;
import com.atrium.ids.LocalIdAllocator;
import com.atrium.lifecycle.ScenePhase;
import com.atrium.modules.RegionModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for SceneBuilder's single-use setup phase.
 */
public class SceneBuilderTest {
    
    @Mock
    private SceneBehavior behavior;
    
    @Mock
    private RegionModule terrain;
    
    @Mock
    private RegionModule otherTerrain;
    
    private SceneBuilder builder;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(terrain.getName()).thenReturn("terrain");
        
        builder = new SceneBuilder(SceneConfig.defaults().withRegionName("Builder Region"))
            .behavior(behavior);
    }
    
    @Test
    @DisplayName("Should build a running scene with the registered modules")
    void testBuild() {
        Scene scene = builder
            .addModule("terrain", terrain)
            .addModule("terrain", otherTerrain)
            .build();
        
        assertEquals(ScenePhase.RUNNING, scene.getPhase());
        assertSame(terrain, scene.getModule("terrain"));
        assertEquals(1, scene.getModules().size());
        assertEquals("Builder Region", scene.getRegionInfo().regionName());
    }
    
    @Test
    @DisplayName("Should refuse to be used after building")
    void testConsumedOnce() {
        builder.build();
        
        assertThrows(IllegalStateException.class, () -> builder.build());
        assertThrows(IllegalStateException.class, () -> builder.addModule("terrain", terrain));
        assertThrows(IllegalStateException.class,
            () -> builder.registerModuleInterface(RegionModule.class, terrain));
        assertThrows(IllegalStateException.class,
            () -> builder.stackModuleInterface(RegionModule.class, terrain));
        assertThrows(IllegalStateException.class,
            () -> builder.registerModuleCommander(new DefaultCommander("late")));
    }
    
    @Test
    @DisplayName("Should require a scene behavior")
    void testBehaviorRequired() {
        SceneBuilder withoutBehavior = SceneBuilder.create();
        
        assertThrows(IllegalStateException.class, withoutBehavior::build);
        
        // A failed build does not consume the builder
        Scene scene = withoutBehavior.behavior(behavior).build();
        assertNotNull(scene);
    }
    
    @Test
    @DisplayName("Should carry commanders registered during setup into the scene")
    void testCommandersCarriedOver() {
        DefaultCommander commander = new DefaultCommander("terrain")
            .addCommand("fill", "fill <height>", "Fills the terrain", (module, args) -> { });
        
        Scene scene = builder.registerModuleCommander(commander).build();
        
        assertSame(commander, scene.getCommander("terrain"));
        assertNotNull(scene.getCommand("fill"));
    }
    
    @Test
    @DisplayName("Should seed local ids from the configuration")
    void testLocalIdSeed() {
        Scene scene = new SceneBuilder(SceneConfig.defaults().withLocalIdSeed(10))
            .behavior(behavior)
            .build();
        
        assertEquals(11L, scene.allocateLocalId());
        assertEquals(12L, scene.allocateLocalId());
    }
    
    @Test
    @DisplayName("Should keep registrations open after a failed build")
    void testFailedBuildLeavesBuilderOpen() {
        SceneBuilder withoutBehavior = SceneBuilder.create().addModule("terrain", terrain);
        
        assertThrows(IllegalStateException.class, withoutBehavior::build);
        
        Scene scene = withoutBehavior
            .addModule("water", otherTerrain)
            .registerModuleInterface(RegionModule.class, terrain)
            .behavior(behavior)
            .build();
        
        assertEquals(2, scene.getModules().size());
        assertSame(terrain, scene.requestModuleInterface(RegionModule.class));
        assertEquals(ScenePhase.RUNNING, scene.getPhase());
    }
    
    @Test
    @DisplayName("Should reject local id seeds outside the unsigned 32-bit range")
    void testSeedOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> SceneConfig.defaults().withLocalIdSeed(-1));
        assertThrows(IllegalArgumentException.class,
            () -> SceneConfig.defaults().withLocalIdSeed(LocalIdAllocator.MAX_LOCAL_ID + 1));
        
        // The builder is untouched by the rejected configuration
        Scene scene = builder.addModule("terrain", terrain).build();
        assertEquals(LocalIdAllocator.DEFAULT_SEED + 1, scene.allocateLocalId());
    }
    
    @Test
    @DisplayName("Should build the scene for a replaced region")
    void testRegionInfoOverride() {
        Scene scene = builder
            .regionInfo(RegionInfo.at("Harbour", 1001, 1000))
            .build();
        
        assertEquals("Harbour", scene.getRegionInfo().regionName());
        assertEquals(RegionInfo.handleFor(1001, 1000), scene.getRegionInfo().regionHandle());
        assertEquals(ScenePhase.RUNNING, scene.getPhase());
    }
}
