package com.dagrun.core.target;

/**
 * Output of a task that persists nothing. Never exists, so its task always runs.
 */
public enum NoTarget implements Target {
    INSTANCE;

    @Override
    public boolean exists() {
        return false;
    }
}
