package com.dagrun.core.task;

import com.dagrun.core.target.Target;

import java.util.List;

/**
 * A requirement on data produced outside the pipeline. It is done when its target exists
 * and fails when asked to run.
 */
public record ExternalTask(Target target) implements Task {

    public ExternalTask {
        if (target == null) {
            throw new IllegalArgumentException("target must not be null");
        }
    }

    @Override
    public Target output() {
        return target;
    }

    @Override
    public void run(List<Target> inputs, RunOptions options) {
        throw new MissingExternalOutputException(target);
    }
}
