package com.dagrun.core.scheduler;

import com.dagrun.core.DagrunException;
import com.dagrun.core.task.Task;

/**
 * Records the error thrown by a task's run entry point. The cause is the original error.
 */
public class TaskExecutionFailure extends DagrunException {

    private final Task task;

    public TaskExecutionFailure(Task task, Throwable cause) {
        super("Run of " + task + " failed: " + cause, cause);
        this.task = task;
    }

    public Task task() {
        return task;
    }
}
