package com.vibeloop.core.handlers;

import java.time.Duration;

/**
 * Backoff wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
