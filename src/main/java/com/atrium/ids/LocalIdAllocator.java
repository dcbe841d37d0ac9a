package com.atrium.ids;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out unique local ids for objects in one scene.
 * 
 * Ids are unsigned 32-bit values carried in a {@code long}. They start just
 * above the seed, increase strictly and are never reused. Allocation never
 * wraps: once the id space is used up every call fails.
 */
public class LocalIdAllocator {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalIdAllocator.class);
    
    public static final long DEFAULT_SEED = 720000L;
    public static final long MAX_LOCAL_ID = 0xFFFFFFFFL;
    
    private final AtomicLong lastAllocatedLocalId;
    
    public LocalIdAllocator() {
        this(DEFAULT_SEED);
    }
    
    /**
     * @param seed the last id considered taken; the first id handed out is {@code seed + 1}
     * @throws IllegalArgumentException if the seed is outside the 32-bit unsigned range
     */
    public LocalIdAllocator(long seed) {
        if (seed < 0 || seed > MAX_LOCAL_ID) {
            throw new IllegalArgumentException("Local id seed out of range: " + seed);
        }
        this.lastAllocatedLocalId = new AtomicLong(seed);
    }
    
    /**
     * Returns a new unallocated local id.
     * 
     * @return a brand new local id
     * @throws LocalIdExhaustedException if the 32-bit id space is used up
     */
    public long allocateLocalId() {
        while (true) {
            long current = lastAllocatedLocalId.get();
            if (current >= MAX_LOCAL_ID) {
                LOGGER.error("Local id space exhausted at {}", current);
                throw new LocalIdExhaustedException(current);
            }
            
            long next = current + 1;
            if (lastAllocatedLocalId.compareAndSet(current, next)) {
                return next;
            }
        }
    }
    
    /**
     * The last id handed out, or the seed if none has been allocated yet.
     */
    public long getLastAllocatedLocalId() {
        return lastAllocatedLocalId.get();
    }
}
