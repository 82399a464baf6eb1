package com.mimecast.mailhealth.probe;

import java.time.Duration;

/**
 * Pause abstraction so poll loops can run against a fake clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Thread based sleeper.
     */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /**
     * Pauses for the given duration.
     *
     * @param duration Duration.
     * @throws InterruptedException When interrupted.
     */
    void sleep(Duration duration) throws InterruptedException;
}
