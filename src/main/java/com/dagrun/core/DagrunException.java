package com.dagrun.core;

/**
 * Base type for every error raised or recorded by the task graph runtime.
 */
public class DagrunException extends RuntimeException {

    public DagrunException(String message) {
        super(message);
    }

    public DagrunException(String message, Throwable cause) {
        super(message, cause);
    }
}
