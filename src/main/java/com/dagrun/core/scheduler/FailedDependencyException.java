package com.dagrun.core.scheduler;

import com.dagrun.core.DagrunException;
import com.dagrun.core.task.Task;

/**
 * Attached to a task that was never run because an upstream task failed.
 * The cause is always the originating {@link TaskExecutionFailure}, however deep the chain.
 */
public class FailedDependencyException extends DagrunException {

    private final Task task;
    private final TaskExecutionFailure origin;

    public FailedDependencyException(Task task, TaskExecutionFailure origin) {
        super("Skipped " + task + ": upstream " + origin.task() + " failed", origin);
        this.task = task;
        this.origin = origin;
    }

    public Task task() {
        return task;
    }

    public TaskExecutionFailure origin() {
        return origin;
    }
}
