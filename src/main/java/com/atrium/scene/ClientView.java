package com.atrium.scene;

import java.util.UUID;

/**
 * The scene's view of a connected client.
 */
public interface ClientView {
    
    UUID getAgentId();
    
    /**
     * Sends terrain layer data to the client.
     * 
     * @param heightmap the serialised heightmap, row-major
     */
    void sendLayerData(float[] heightmap);
}
