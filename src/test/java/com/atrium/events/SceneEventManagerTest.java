package com.atrium.events;

import com.atrium.scene.RegionInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SceneEventManager dispatch.
 */
public class SceneEventManagerTest {
    
    private final RegionInfo region = RegionInfo.at("Test Region", 1000, 1000);
    private SceneEventManager eventManager;
    
    @BeforeEach
    void setUp() {
        eventManager = new SceneEventManager();
    }
    
    @Test
    @DisplayName("Should treat a restart with no listeners as a no-op")
    void testRestartWithoutListeners() {
        int delivered = assertDoesNotThrow(() -> eventManager.triggerRestart(region));
        assertEquals(0, delivered);
    }
    
    @Test
    @DisplayName("Should notify restart listeners in registration order")
    void testRestartOrder() {
        List<String> calls = new ArrayList<>();
        eventManager.onRestart(r -> calls.add("first:" + r.regionName()));
        eventManager.onRestart(r -> calls.add("second:" + r.regionName()));
        
        assertEquals(2, eventManager.triggerRestart(region));
        assertEquals(List.of("first:Test Region", "second:Test Region"), calls);
    }
    
    @Test
    @DisplayName("Should keep notifying restart listeners after one fails")
    void testRestartListenerFailure() {
        List<String> calls = new ArrayList<>();
        eventManager.onRestart(r -> {
            throw new IllegalStateException("boom");
        });
        eventManager.onRestart(r -> calls.add("after"));
        
        assertEquals(1, eventManager.triggerRestart(region));
        assertEquals(List.of("after"), calls);
    }
    
    @Test
    @DisplayName("Should stop notifying removed listeners")
    void testRemoveListener() {
        List<String> calls = new ArrayList<>();
        RestartListener listener = r -> calls.add("called");
        eventManager.onRestart(listener);
        
        assertTrue(eventManager.removeRestartListener(listener));
        assertFalse(eventManager.removeRestartListener(listener));
        eventManager.triggerRestart(region);
        
        assertTrue(calls.isEmpty());
        assertEquals(0, eventManager.getRestartListenerCount());
    }
    
    @Test
    @DisplayName("Should call every shutdown listener and report failures together")
    void testShutdownFailuresAggregated() {
        List<String> calls = new ArrayList<>();
        eventManager.onShutdown(() -> {
            throw new IllegalStateException("first");
        });
        eventManager.onShutdown(() -> calls.add("middle"));
        eventManager.onShutdown(() -> {
            throw new IllegalStateException("last");
        });
        
        SceneEventException e = assertThrows(SceneEventException.class, eventManager::triggerShutdown);
        
        assertEquals(List.of("middle"), calls);
        assertEquals(2, e.getSuppressed().length);
    }
    
    @Test
    @DisplayName("Should deliver shutdown without error when nobody listens")
    void testShutdownWithoutListeners() {
        assertDoesNotThrow(eventManager::triggerShutdown);
        assertEquals(0, eventManager.getShutdownListenerCount());
    }
}
