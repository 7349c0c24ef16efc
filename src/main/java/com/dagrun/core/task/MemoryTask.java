package com.dagrun.core.task;

import com.dagrun.core.target.MemoryTarget;

import java.util.List;
import java.util.Objects;

/**
 * A task whose output lives in an in-process {@link MemoryTarget} and is dropped on cleanup.
 * <p>
 * The memory slot is not part of the task's identity: equality and hashing use the
 * concrete class and {@link #identity()} only.
 *
 * @param <T> type of the value held in memory
 */
public abstract class MemoryTask<T> implements CleanableTask {

    private final MemoryTarget<T> slot = new MemoryTarget<>();

    /** The declared field values that identify this task. */
    protected abstract List<?> identity();

    @Override
    public MemoryTarget<T> output() {
        return slot;
    }

    public T get() {
        return slot.get();
    }

    public void set(T value) {
        slot.set(value);
    }

    @Override
    public void cleanup(RunOptions options) {
        slot.delete();
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return identity().equals(((MemoryTask<?>) o).identity());
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), identity());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + identity();
    }
}
