package com.dagrun.core.graph;

import com.dagrun.core.task.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One deduplicated task in a {@link Dag}, with its edges in both directions.
 * Nodes compare by identity; the task inside compares by value.
 */
public final class TaskNode {

    private final Task task;
    private final boolean doneAtDiscovery;
    private final List<TaskNode> requirements = new ArrayList<>();
    private final Set<TaskNode> dependencies = new LinkedHashSet<>();
    private final Set<TaskNode> dependents = new LinkedHashSet<>();

    TaskNode(Task task, boolean doneAtDiscovery) {
        this.task = task;
        this.doneAtDiscovery = doneAtDiscovery;
    }

    public Task task() {
        return task;
    }

    /** {@link NodeStatus#DONE_ALREADY} or {@link NodeStatus#PENDING}. */
    public NodeStatus discoveryStatus() {
        return doneAtDiscovery ? NodeStatus.DONE_ALREADY : NodeStatus.PENDING;
    }

    public boolean isDoneAlready() {
        return doneAtDiscovery;
    }

    /** Requirement nodes in {@code requires()} order, repeats included; one run input each. */
    public List<TaskNode> requirements() {
        return Collections.unmodifiableList(requirements);
    }

    public Set<TaskNode> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<TaskNode> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    void require(TaskNode dependency) {
        requirements.add(dependency);
        dependencies.add(dependency);
        dependency.dependents.add(this);
    }

    @Override
    public String toString() {
        return "TaskNode[" + task + (doneAtDiscovery ? ", done" : "") + "]";
    }
}
