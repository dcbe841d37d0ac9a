package com.atrium.scene;

/**
 * Read access to a region's terrain heightmap.
 */
public interface TerrainChannel {
    
    /**
     * @return the heightmap serialised row-major
     */
    float[] getFloatsSerialised();
}
