package com.taskforge.core.concurrent;

/**
 * Blocking pause used by backoff loops, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
