package com.atrium.scene;

import java.util.UUID;

/**
 * World behavior plugged into a {@link Scene}: simulation ticks, terrain and
 * client management.
 */
public interface SceneBehavior {
    
    /**
     * Called once per frame to let the world perform whatever it needs, such as running physics.
     */
    void update();
    
    /**
     * Loads the world heightmap.
     */
    void loadWorldMap();
    
    /**
     * Registers a new client with the scene. The client starts off as a child agent.
     */
    void addNewClient(ClientView client);
    
    void removeClient(UUID agentId);
    
    void closeAllAgents(long circuitCode);
    
    /**
     * Told when a neighbouring region comes up.
     * 
     * @return true if the neighbour was accepted
     */
    boolean otherRegionUp(RegionInfo otherRegion);
    
    /**
     * Whether the avatar is present in this scene as a child agent.
     */
    default boolean presenceChildStatus(UUID avatarId) {
        return false;
    }
}
