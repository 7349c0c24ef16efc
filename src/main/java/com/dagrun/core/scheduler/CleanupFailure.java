package com.dagrun.core.scheduler;

import com.dagrun.core.DagrunException;
import com.dagrun.core.task.Task;

/**
 * Records an error thrown by a task's cleanup entry point. Never escalated to dependents.
 */
public class CleanupFailure extends DagrunException {

    private final Task task;

    public CleanupFailure(Task task, Throwable cause) {
        super("Cleanup of " + task + " failed: " + cause, cause);
        this.task = task;
    }

    public Task task() {
        return task;
    }
}
