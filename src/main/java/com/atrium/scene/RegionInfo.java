package com.atrium.scene;

import java.util.Objects;

/**
 * Identity and grid placement of a region.
 * 
 * @param regionName the region's display name
 * @param regionHandle the region's grid handle
 * @param regionLocX grid x coordinate, in region units
 * @param regionLocY grid y coordinate, in region units
 */
public record RegionInfo(String regionName, long regionHandle, int regionLocX, int regionLocY) {
    
    /** Edge length of a region, in meters. */
    public static final int REGION_SIZE = 256;
    
    public RegionInfo {
        Objects.requireNonNull(regionName, "regionName");
    }
    
    /**
     * Creates region info, deriving the handle from the grid location.
     */
    public static RegionInfo at(String regionName, int regionLocX, int regionLocY) {
        return new RegionInfo(regionName, handleFor(regionLocX, regionLocY), regionLocX, regionLocY);
    }
    
    /**
     * Packs a grid location into a region handle: world x in the high 32 bits, world y in the low 32 bits.
     */
    public static long handleFor(int regionLocX, int regionLocY) {
        long worldX = Integer.toUnsignedLong(regionLocX * REGION_SIZE);
        long worldY = Integer.toUnsignedLong(regionLocY * REGION_SIZE);
        return (worldX << 32) | worldY;
    }
}
