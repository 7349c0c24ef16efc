package com.dagrun.core.graph;

import com.dagrun.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers the task graph reachable from a set of root tasks.
 * <p>
 * Tasks are deduplicated by value. A task whose {@code done()} is true becomes a
 * {@link NodeStatus#DONE_ALREADY} leaf and its {@code requires()} is never called.
 * Revisiting a task that is still being expanded fails with {@link CyclicDependencyException}.
 * Errors from {@code done()} or {@code requires()} are wrapped in {@link DiscoveryException}.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public Dag build(Task... roots) {
        return build(List.of(roots));
    }

    public Dag build(Collection<? extends Task> roots) {
        var nodes = new LinkedHashMap<Task, TaskNode>();
        for (Task root : roots) {
            if (root == null) {
                throw new IllegalArgumentException("Root task must not be null");
            }
            if (!nodes.containsKey(root)) {
                expand(root, nodes);
            }
        }
        List<TaskNode> order = topologicalOrder(nodes.values());
        log.info("Built DAG from {} root(s): {} nodes, {} already done",
                roots.size(), order.size(), order.stream().filter(TaskNode::isDoneAlready).count());
        return new Dag(order, nodes);
    }

    /** Depth-first expansion with an explicit stack; the stack is the active requirement chain. */
    private void expand(Task root, Map<Task, TaskNode> nodes) {
        Deque<Frame> stack = new ArrayDeque<>();
        Set<Task> active = new HashSet<>();

        Frame rootFrame = discover(root, nodes);
        if (rootFrame == null) {
            return;
        }
        stack.push(rootFrame);
        active.add(root);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.pending.hasNext()) {
                stack.pop();
                active.remove(frame.node.task());
                continue;
            }
            Task required = frame.pending.next();
            if (required == null) {
                throw new DiscoveryException(frame.node.task(), "requires()",
                        new NullPointerException("requires() returned a null task"));
            }
            if (active.contains(required)) {
                throw new CyclicDependencyException(chain(stack, required));
            }
            TaskNode dependency = nodes.get(required);
            if (dependency == null) {
                Frame child = discover(required, nodes);
                dependency = nodes.get(required);
                if (child != null) {
                    stack.push(child);
                    active.add(required);
                }
            }
            frame.node.require(dependency);
        }
    }

    /**
     * Registers a node for a task seen for the first time.
     *
     * @return a frame to expand, or {@code null} when the task is already done
     */
    private Frame discover(Task task, Map<Task, TaskNode> nodes) {
        boolean done;
        try {
            done = task.done();
        } catch (RuntimeException | Error e) {
            throw new DiscoveryException(task, "done()", e);
        }
        TaskNode node = new TaskNode(task, done);
        nodes.put(task, node);
        if (done) {
            log.debug("{} already done, not expanding", task);
            return null;
        }
        List<? extends Task> required;
        try {
            required = task.requires();
        } catch (RuntimeException | Error e) {
            throw new DiscoveryException(task, "requires()", e);
        }
        if (required == null) {
            required = List.of();
        }
        return new Frame(node, new ArrayList<Task>(required).iterator());
    }

    private static List<Task> chain(Deque<Frame> stack, Task revisited) {
        var chain = new ArrayList<Task>();
        boolean inCycle = false;
        Iterator<Frame> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            Task task = bottomUp.next().node.task();
            if (task.equals(revisited)) {
                inCycle = true;
            }
            if (inCycle) {
                chain.add(task);
            }
        }
        chain.add(revisited);
        return chain;
    }

    /** Kahn's algorithm; ties keep discovery order. */
    private static List<TaskNode> topologicalOrder(Collection<TaskNode> nodes) {
        var unresolved = new HashMap<TaskNode, Integer>();
        var ready = new ArrayDeque<TaskNode>();
        for (TaskNode node : nodes) {
            unresolved.put(node, node.dependencies().size());
            if (node.dependencies().isEmpty()) {
                ready.add(node);
            }
        }
        var order = new ArrayList<TaskNode>(nodes.size());
        while (!ready.isEmpty()) {
            TaskNode node = ready.poll();
            order.add(node);
            for (TaskNode dependent : node.dependents()) {
                if (unresolved.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != nodes.size()) {
            throw new IllegalStateException("Graph contains a cycle that escaped discovery: "
                    + (nodes.size() - order.size()) + " node(s) unordered");
        }
        return order;
    }

    private record Frame(TaskNode node, Iterator<? extends Task> pending) {}
}
