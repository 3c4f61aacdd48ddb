package com.narraflow.narraflow_backend.collab;

/**
 * Monotonic millisecond clock for lease expiry. Never goes backwards, unlike wall-clock time.
 */
@FunctionalInterface
public interface LeaseClock {

    long nowMillis();

    static LeaseClock system() {
        return () -> System.nanoTime() / 1_000_000L;
    }
}
