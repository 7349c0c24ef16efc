package com.dagrun.core.task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A task whose output is an intermediate artifact that can be released once every
 * dependent task has finished with it.
 */
public interface CleanableTask extends Task {

    default void cleanup(RunOptions options) throws Exception {
    }

    default CompletionStage<?> cleanupAsync(RunOptions options) {
        try {
            cleanup(options);
            return CompletableFuture.completedFuture(null);
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
