package com.dagrun.core.scheduler;

import com.dagrun.core.DagrunException;
import com.dagrun.core.graph.NodeStatus;
import com.dagrun.core.task.Task;

import java.time.Duration;
import java.util.Optional;

/**
 * Final state of one task after a run.
 *
 * @param task         the task
 * @param status       terminal status, or PENDING for tasks never started in a cancelled run
 * @param error        {@link TaskExecutionFailure} for FAILED, {@link FailedDependencyException}
 *                     for SKIPPED_DEPENDENCY_FAILURE, otherwise null
 * @param cleanedUp    whether the task's cleanup ran to completion
 * @param cleanupError error raised by cleanup, if any
 * @param elapsed      time spent in the run entry point (zero if it never ran)
 */
public record TaskOutcome(
    Task task,
    NodeStatus status,
    DagrunException error,
    boolean cleanedUp,
    CleanupFailure cleanupError,
    Duration elapsed
) {

    public Optional<DagrunException> failure() {
        return Optional.ofNullable(error);
    }

    public Optional<CleanupFailure> cleanupFailure() {
        return Optional.ofNullable(cleanupError);
    }

    /**
     * The original run error behind a failed or skipped task.
     */
    public Optional<Throwable> rootCause() {
        if (error instanceof FailedDependencyException skipped) {
            return Optional.ofNullable(skipped.origin().getCause());
        }
        return error == null ? Optional.empty() : Optional.ofNullable(error.getCause());
    }
}
