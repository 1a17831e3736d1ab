package com.taskforge.core.react;

/**
 * Receives human-readable progress notes from a running ReAct loop.
 */
@FunctionalInterface
public interface RunListener {

    RunListener NONE = message -> { };

    void onStep(String message);
}
