package com.atrium.config;

import com.atrium.ids.LocalIdAllocator;
import com.atrium.scene.RegionInfo;

import java.util.Objects;

/**
 * Settings a scene is built from.
 * 
 * @param regionName the region's display name
 * @param localIdSeed last local id considered taken; allocation starts above it
 * @param simulatorVersion version string the scene reports
 * @param regionLocX grid x coordinate
 * @param regionLocY grid y coordinate
 */
public record SceneConfig(
    String regionName,
    long localIdSeed,
    String simulatorVersion,
    int regionLocX,
    int regionLocY
) {
    
    public static final String DEFAULT_REGION_NAME = "Unnamed Region";
    public static final String DEFAULT_SIMULATOR_VERSION = "Atrium Server";
    
    public SceneConfig {
        Objects.requireNonNull(regionName, "regionName");
        if (localIdSeed < 0 || localIdSeed > LocalIdAllocator.MAX_LOCAL_ID) {
            throw new IllegalArgumentException(
                String.format("localIdSeed must be between 0 and %d, got %d", LocalIdAllocator.MAX_LOCAL_ID, localIdSeed)
            );
        }
    }
    
    /**
     * Built-in settings, used when no configuration is supplied.
     */
    public static SceneConfig defaults() {
        return new SceneConfig(DEFAULT_REGION_NAME, LocalIdAllocator.DEFAULT_SEED, DEFAULT_SIMULATOR_VERSION, 1000, 1000);
    }
    
    public RegionInfo toRegionInfo() {
        return RegionInfo.at(regionName, regionLocX, regionLocY);
    }
    
    public SceneConfig withRegionName(String name) {
        return new SceneConfig(name, localIdSeed, simulatorVersion, regionLocX, regionLocY);
    }
    
    public SceneConfig withLocalIdSeed(long seed) {
        return new SceneConfig(regionName, seed, simulatorVersion, regionLocX, regionLocY);
    }
}
