package com.dagrun.core.graph;

import com.dagrun.core.DagrunException;
import com.dagrun.core.task.Task;

/**
 * Wraps an error thrown by a task's {@code done()} or {@code requires()} during discovery.
 */
public class DiscoveryException extends DagrunException {

    private final Task task;

    public DiscoveryException(Task task, String phase, Throwable cause) {
        super("Discovery of " + task + " failed in " + phase + ": " + cause.getMessage(), cause);
        this.task = task;
    }

    public Task task() {
        return task;
    }
}
