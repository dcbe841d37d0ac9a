package com.atrium.events;

import com.atrium.scene.RegionInfo;

/**
 * Notified when a region asks its host to restart it.
 */
@FunctionalInterface
public interface RestartListener {
    
    void onRestart(RegionInfo region);
}
