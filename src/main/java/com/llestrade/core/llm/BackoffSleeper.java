package com.llestrade.core.llm;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced by a no-op in tests.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
