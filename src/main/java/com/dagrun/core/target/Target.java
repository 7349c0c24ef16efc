package com.dagrun.core.target;

/**
 * An addressable artifact produced by a task. The runtime only ever asks whether it exists.
 */
public interface Target {

    boolean exists();
}
