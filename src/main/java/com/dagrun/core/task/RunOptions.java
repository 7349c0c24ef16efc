package com.dagrun.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named options forwarded unchanged to every run and cleanup invocation.
 * <p>
 * Callers use these to hand tasks an external executor, a {@code ResourcePool},
 * credentials, or any other collaborator the scheduler itself knows nothing about.
 */
public final class RunOptions {

    private static final RunOptions EMPTY = new RunOptions(Map.of());

    private final Map<String, Object> values;

    private RunOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static RunOptions empty() {
        return EMPTY;
    }

    public static RunOptions of(Map<String, ?> values) {
        return values.isEmpty() ? EMPTY
                : new RunOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the option with the given name.
     *
     * @throws IllegalArgumentException if the option is absent or not of the requested type
     */
    public <T> T get(String name, Class<T> type) {
        return find(name, type).orElseThrow(() ->
                new IllegalArgumentException("Missing run option '" + name + "' of type " + type.getName()));
    }

    public <T> Optional<T> find(String name, Class<T> type) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Run option '" + name + "' is a "
                    + value.getClass().getName() + ", not " + type.getName());
        }
        return Optional.of(type.cast(value));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RunOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RunOptions" + values.keySet();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, Object value) {
            if (name == null || value == null) {
                throw new IllegalArgumentException("Run option name and value must not be null");
            }
            values.put(name, value);
            return this;
        }

        public RunOptions build() {
            return RunOptions.of(values);
        }
    }
}
