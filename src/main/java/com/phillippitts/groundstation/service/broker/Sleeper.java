package com.phillippitts.groundstation.service.broker;

import java.time.Duration;

/**
 * Blocking pause between reconnect attempts; replaced in tests to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
