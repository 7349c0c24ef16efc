package com.dagrun.core.graph;

import com.dagrun.core.DagrunException;
import com.dagrun.core.task.Task;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when task discovery revisits a task that is still on the active requirement chain.
 * No partial graph is returned.
 */
public class CyclicDependencyException extends DagrunException {

    private final List<Task> chain;

    public CyclicDependencyException(List<Task> chain) {
        super("Cyclic dependency: " + chain.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" -> ")));
        this.chain = List.copyOf(chain);
    }

    /** The requirement chain, starting and ending with the revisited task. */
    public List<Task> chain() {
        return chain;
    }
}
