package com.dagrun.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a DAG runs.
 *
 * @param eventType event type (e.g. "task.started", "task.failed", "cleanup.succeeded", "run.completed")
 * @param runId     the run this event belongs to
 * @param task      string form of the task this event relates to (null for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record DagEvent(
    String eventType,
    String runId,
    String task,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_ALREADY_DONE = "task.already-done";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_SKIPPED = "task.skipped";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String CLEANUP_STARTED = "cleanup.started";
    public static final String CLEANUP_SUCCEEDED = "cleanup.succeeded";
    public static final String CLEANUP_FAILED = "cleanup.failed";
    public static final String RUN_COMPLETED = "run.completed";
}
