package com.dagrun.core.scheduler;

import com.dagrun.core.graph.NodeStatus;
import com.dagrun.core.task.Task;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-task outcomes of one scheduler run, in the DAG's topological order.
 */
public final class RunReport {

    private final String runId;
    private final List<TaskOutcome> outcomes;
    private final Map<Task, TaskOutcome> byTask = new LinkedHashMap<>();
    private final boolean cancelled;

    public RunReport(String runId, List<TaskOutcome> outcomes, boolean cancelled) {
        this.runId = runId;
        this.outcomes = List.copyOf(outcomes);
        this.cancelled = cancelled;
        for (TaskOutcome outcome : this.outcomes) {
            byTask.put(outcome.task(), outcome);
        }
    }

    public String runId() {
        return runId;
    }

    public List<TaskOutcome> outcomes() {
        return outcomes;
    }

    public boolean cancelled() {
        return cancelled;
    }

    public Optional<TaskOutcome> outcome(Task task) {
        return Optional.ofNullable(byTask.get(task));
    }

    public NodeStatus statusOf(Task task) {
        TaskOutcome outcome = byTask.get(task);
        if (outcome == null) {
            throw new IllegalArgumentException("Task not part of this run: " + task);
        }
        return outcome.status();
    }

    public List<TaskOutcome> withStatus(NodeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).toList();
    }

    public Map<NodeStatus, Long> countsByStatus() {
        var counts = new EnumMap<NodeStatus, Long>(NodeStatus.class);
        for (TaskOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1L, Long::sum);
        }
        return counts;
    }

    public List<TaskOutcome> cleanupFailures() {
        return outcomes.stream().filter(o -> o.cleanupError() != null).toList();
    }

    /** Every task reached a terminal status (false only for cancelled runs). */
    public boolean isComplete() {
        return outcomes.stream().allMatch(o -> o.status().isTerminal());
    }

    /** Complete, with no failed or skipped task and no cleanup error. */
    public boolean allSucceeded() {
        return isComplete() && outcomes.stream()
                .noneMatch(o -> o.status().isFailure() || o.status() == NodeStatus.CANCELLED
                        || o.cleanupError() != null);
    }

    @Override
    public String toString() {
        return "RunReport[" + runId + ", " + countsByStatus() + (cancelled ? ", cancelled" : "") + "]";
    }
}
