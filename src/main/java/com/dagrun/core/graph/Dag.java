package com.dagrun.core.graph;

import com.dagrun.core.task.Task;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The cycle-free task graph discovered from a set of root tasks.
 * <p>
 * {@link #nodes()} is in topological order: every dependency precedes its dependents.
 * The relative order of unrelated nodes is unspecified.
 */
public final class Dag {

    private final List<TaskNode> nodes;
    private final Map<Task, TaskNode> byTask;
    private final Map<TaskNode, Integer> positions = new IdentityHashMap<>();

    Dag(List<TaskNode> topologicalOrder, Map<Task, TaskNode> byTask) {
        this.nodes = List.copyOf(topologicalOrder);
        this.byTask = Collections.unmodifiableMap(byTask);
        for (int i = 0; i < nodes.size(); i++) {
            positions.put(nodes.get(i), i);
        }
    }

    public List<TaskNode> nodes() {
        return nodes;
    }

    public List<Task> topologicalOrder() {
        return nodes.stream().map(TaskNode::task).toList();
    }

    public Optional<TaskNode> node(Task task) {
        return Optional.ofNullable(byTask.get(task));
    }

    public int indexOf(TaskNode node) {
        Integer index = positions.get(node);
        return index == null ? -1 : index;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Nodes that still need work, i.e. not already done at discovery. */
    public long pendingCount() {
        return nodes.stream().filter(n -> !n.isDoneAlready()).count();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("Dag[").append(nodes.size()).append(" nodes]");
        for (TaskNode node : nodes) {
            sb.append("\n  ").append(node.task());
            for (TaskNode dep : node.dependencies()) {
                sb.append("\n    <= ").append(dep.task());
            }
        }
        return sb.toString();
    }
}
