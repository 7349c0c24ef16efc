package com.dagrun.core.resources;

import com.dagrun.core.DagrunException;

/**
 * Thrown when a resource request can never be satisfied or resources are returned that were not held.
 */
public class ResourceException extends DagrunException {

    public ResourceException(String message) {
        super(message);
    }
}
