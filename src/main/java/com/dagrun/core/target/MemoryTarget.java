package com.dagrun.core.target;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-assignment in-process slot. Never reports {@code exists()}, so the owning task
 * is recomputed on every run.
 *
 * @param <T> held value type
 */
public final class MemoryTarget<T> implements Target {

    private static final Object UNSET = new Object();

    private final AtomicReference<Object> value = new AtomicReference<>(UNSET);

    @Override
    public boolean exists() {
        return false;
    }

    public boolean isSet() {
        return value.get() != UNSET;
    }

    public void set(T val) {
        if (!value.compareAndSet(UNSET, val)) {
            throw new IllegalStateException("Memory target already set");
        }
    }

    @SuppressWarnings("unchecked")
    public T get() {
        Object current = value.get();
        if (current == UNSET) {
            throw new IllegalStateException("Memory target read before it was set");
        }
        return (T) current;
    }

    public void delete() {
        if (value.getAndSet(UNSET) == UNSET) {
            throw new IllegalStateException("Memory target deleted before it was set");
        }
    }

    @Override
    public String toString() {
        return isSet() ? "MemoryTarget[set]" : "MemoryTarget[unset]";
    }
}
