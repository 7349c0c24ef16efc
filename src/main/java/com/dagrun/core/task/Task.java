package com.dagrun.core.task;

import com.dagrun.core.target.NoTarget;
import com.dagrun.core.target.Target;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A value-identified unit of batch work with declared requirements and a target output.
 * <p>
 * Implementations must define structural {@code equals}/{@code hashCode} over their declared
 * fields; records do this for free. Two equal tasks collapse into one graph node.
 */
public interface Task {

    /** Tasks whose outputs this task consumes, in the order they are passed to {@link #run}. */
    default List<? extends Task> requires() {
        return List.of();
    }

    default Target output() {
        return NoTarget.INSTANCE;
    }

    /** Whether the output is already present; such a task is neither expanded nor run. */
    default boolean done() {
        return output().exists();
    }

    /**
     * Produces the output synchronously.
     *
     * @param inputs  outputs of {@link #requires()}, in the same order
     * @param options forwarded run options
     */
    default void run(List<Target> inputs, RunOptions options) throws Exception {
    }

    /**
     * Produces the output, completing the returned stage when finished.
     * <p>
     * The default calls {@link #run} on the calling thread. Override to hand work to an
     * executor taken from {@code options} so that other tasks can proceed meanwhile.
     */
    default CompletionStage<?> runAsync(List<Target> inputs, RunOptions options) {
        try {
            run(inputs, options);
            return CompletableFuture.completedFuture(null);
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
