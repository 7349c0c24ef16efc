package com.dagrun.core.graph;

/**
 * Lifecycle of a node within one scheduler run.
 */
public enum NodeStatus {
    PENDING,
    DONE_ALREADY,   // output existed at discovery; never expanded or run
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED_DEPENDENCY_FAILURE,
    CANCELLED;      // in flight when the run was interrupted

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** Terminal and usable as an input by dependents. */
    public boolean isSatisfied() {
        return this == DONE_ALREADY || this == SUCCEEDED;
    }

    public boolean isFailure() {
        return this == FAILED || this == SKIPPED_DEPENDENCY_FAILURE;
    }
}
