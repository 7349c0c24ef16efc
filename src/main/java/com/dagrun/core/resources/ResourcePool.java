package com.dagrun.core.resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A supply of named, counted resources (e.g. {@code gpu=8, memoryHeavy=2}) shared by tasks.
 * <p>
 * The pool only blocks callers until enough units are free; it does not talk to any executor.
 * Pass it to tasks through the run options and wrap heavy work in an {@link Allocation}:
 * <pre>{@code
 * ResourcePool pool = options.get("resources", ResourcePool.class);
 * try (Allocation allocation = pool.acquire(Map.of("gpu", 2))) {
 *     trainModel();
 *     allocation.release(Map.of("gpu", 1));
 *     evaluate();
 * }
 * }</pre>
 */
public class ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Integer> available = new TreeMap<>();
    private final Map<String, Integer> used = new TreeMap<>();

    public ResourcePool(Map<String, Integer> capacity) {
        validate(capacity);
        capacity.forEach((name, count) -> {
            if (count > 0) {
                available.put(name, count);
            }
        });
    }

    /**
     * Blocks until the requested amounts are free and hands them out as an allocation.
     *
     * @throws ResourceException if the request exceeds the pool's total capacity
     */
    public Allocation acquire(Map<String, Integer> requirement) throws InterruptedException {
        return new Allocation(this, request(requirement));
    }

    /** Grows the pool's total capacity. */
    public void addResources(Map<String, Integer> resources) {
        validate(resources);
        lock.lock();
        try {
            add(available, resources);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> available() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(available));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> used() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(used));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> total() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(total(available, used));
        } finally {
            lock.unlock();
        }
    }

    Map<String, Integer> request(Map<String, Integer> requirement) throws InterruptedException {
        validate(requirement);
        lock.lock();
        try {
            Map<String, Integer> total = total(available, used);
            if (!fits(requirement, total)) {
                throw new ResourceException("Requested incompatible resources: "
                        + requirement + " exceeds total " + total);
            }
            while (!fits(requirement, available)) {
                log.debug("Waiting for resources {} (available {})", requirement, available);
                changed.await();
            }
            subtract(available, requirement);
            add(used, requirement);
            return new TreeMap<>(requirement);
        } finally {
            lock.unlock();
        }
    }

    void giveBack(Map<String, Integer> resources) {
        validate(resources);
        lock.lock();
        try {
            if (!fits(resources, used)) {
                throw new ResourceException("Returning resources not in use: "
                        + resources + " exceeds used " + used);
            }
            subtract(used, resources);
            add(available, resources);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    static boolean fits(Map<String, Integer> requirement, Map<String, Integer> supply) {
        for (var entry : requirement.entrySet()) {
            if (entry.getValue() > supply.getOrDefault(entry.getKey(), 0)) {
                return false;
            }
        }
        return true;
    }

    static void add(Map<String, Integer> into, Map<String, Integer> amounts) {
        amounts.forEach((name, count) -> {
            if (count > 0) {
                into.merge(name, count, Integer::sum);
            }
        });
    }

    static void subtract(Map<String, Integer> from, Map<String, Integer> amounts) {
        amounts.forEach((name, count) -> {
            if (count > 0) {
                from.computeIfPresent(name, (k, v) -> v - count == 0 ? null : v - count);
            }
        });
    }

    private static Map<String, Integer> total(Map<String, Integer> available, Map<String, Integer> used) {
        var total = new TreeMap<>(available);
        add(total, used);
        return total;
    }

    private static void validate(Map<String, Integer> amounts) {
        for (var entry : amounts.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || entry.getValue() < 0) {
                throw new ResourceException("Invalid resource amount: " + entry);
            }
        }
    }
}
