package com.dagrun.core.resources;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resources currently held from a {@link ResourcePool}. Closing returns whatever is still held.
 * Not thread-safe; an allocation belongs to the task that acquired it.
 */
public final class Allocation implements AutoCloseable {

    private final ResourcePool pool;
    private final Map<String, Integer> held = new TreeMap<>();

    Allocation(ResourcePool pool, Map<String, Integer> acquired) {
        this.pool = pool;
        ResourcePool.add(held, acquired);
    }

    public Map<String, Integer> held() {
        return Collections.unmodifiableMap(new TreeMap<>(held));
    }

    /**
     * Requests more resources on top of those held. Two allocations each waiting for the
     * other's units will deadlock.
     */
    public void request(Map<String, Integer> more) throws InterruptedException {
        ResourcePool.add(held, pool.request(more));
    }

    /** Returns part of the held resources to the pool early. */
    public void release(Map<String, Integer> part) {
        if (!ResourcePool.fits(part, held)) {
            throw new ResourceException("Releasing more than held: " + part + " exceeds " + held);
        }
        pool.giveBack(part);
        ResourcePool.subtract(held, part);
    }

    @Override
    public void close() {
        if (!held.isEmpty()) {
            release(new TreeMap<>(held));
        }
    }
}
