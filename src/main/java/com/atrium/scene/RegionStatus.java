package com.atrium.scene;

/**
 * Operational status of a region.
 */
public enum RegionStatus {
    UP,
    DOWN,
    SHUTTING_DOWN,
    SLAVE_SCENE
}
