package com.atrium.events;

import com.atrium.scene.RegionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous event dispatch for scene lifecycle events.
 * 
 * Listeners are notified in registration order. Dispatching an event that
 * nobody listens to does nothing.
 */
public class SceneEventManager {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneEventManager.class);
    
    private final List<RestartListener> restartListeners = new CopyOnWriteArrayList<>();
    private final List<ShutdownListener> shutdownListeners = new CopyOnWriteArrayList<>();
    
    public void onRestart(RestartListener listener) {
        restartListeners.add(Objects.requireNonNull(listener, "listener"));
    }
    
    /**
     * @return true if the listener was subscribed
     */
    public boolean removeRestartListener(RestartListener listener) {
        return restartListeners.remove(listener);
    }
    
    public void onShutdown(ShutdownListener listener) {
        shutdownListeners.add(Objects.requireNonNull(listener, "listener"));
    }
    
    /**
     * @return true if the listener was subscribed
     */
    public boolean removeShutdownListener(ShutdownListener listener) {
        return shutdownListeners.remove(listener);
    }
    
    public int getRestartListenerCount() {
        return restartListeners.size();
    }
    
    public int getShutdownListenerCount() {
        return shutdownListeners.size();
    }
    
    /**
     * Notifies every restart listener.
     * A failing listener is logged and does not stop delivery to the others.
     * 
     * @param region the region asking to be restarted
     * @return the number of listeners notified successfully
     */
    public int triggerRestart(RegionInfo region) {
        int delivered = 0;
        for (RestartListener listener : restartListeners) {
            try {
                listener.onRestart(region);
                delivered++;
            } catch (Exception e) {
                LOGGER.error("Restart listener failed for region '{}'", region.regionName(), e);
            }
        }
        return delivered;
    }
    
    /**
     * Notifies every shutdown listener.
     * 
     * Every listener is called even if an earlier one fails.
     * 
     * @throws SceneEventException if any listener failed, carrying each failure as suppressed
     */
    public void triggerShutdown() {
        SceneEventException failure = null;
        for (ShutdownListener listener : shutdownListeners) {
            try {
                listener.onShutdown();
            } catch (Exception e) {
                if (failure == null) {
                    failure = new SceneEventException("Shutdown listener failed");
                }
                failure.addSuppressed(e);
            }
        }
        
        if (failure != null) {
            throw failure;
        }
        LOGGER.debug("Shutdown delivered to {} listeners", shutdownListeners.size());
    }
}
