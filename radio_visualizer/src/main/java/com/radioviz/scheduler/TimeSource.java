package com.radioviz.scheduler;

/**
 * Monotonic millisecond clock used to pace animation ticks.
 */
@FunctionalInterface
public interface TimeSource {

    long nowMillis();

    /**
     * Clock backed by {@link System#nanoTime()}; unaffected by wall-clock adjustments.
     */
    static TimeSource system() {
        return () -> System.nanoTime() / 1_000_000L;
    }
}
