package com.dagrun.core.task;

import com.dagrun.core.DagrunException;
import com.dagrun.core.target.Target;

/**
 * Thrown when an {@link ExternalTask} is asked to produce a target that only exists outside the pipeline.
 */
public class MissingExternalOutputException extends DagrunException {

    public MissingExternalOutputException(Target target) {
        super("External output does not exist and cannot be produced: " + target);
    }
}
