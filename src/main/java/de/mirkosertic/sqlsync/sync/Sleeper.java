package de.mirkosertic.sqlsync.sync;

/**
 * Blocking pause used for backoff and throttling, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
