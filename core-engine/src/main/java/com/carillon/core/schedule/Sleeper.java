package com.carillon.core.schedule;

import java.time.Duration;

/**
 * Blocking pause, injectable so clock-driven code can be tested without
 * waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps the current thread with {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /**
     * @param duration how long to pause; zero or negative returns at once
     * @throws InterruptedException if the thread is interrupted while paused
     */
    void sleep(Duration duration) throws InterruptedException;
}
