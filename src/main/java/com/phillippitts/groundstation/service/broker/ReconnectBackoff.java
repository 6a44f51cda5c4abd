package com.phillippitts.groundstation.service.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect delay: starts at the initial delay, doubles after every consecutive
 * failure and is capped at the maximum. Not thread-safe; used only by the listener thread.
 */
public final class ReconnectBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private Duration currentDelay;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive, got: " + initialDelay);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        this.currentDelay = initialDelay;
    }

    /**
     * Returns the delay to wait after the current failure and advances to the next one.
     */
    public Duration nextDelay() {
        Duration delay = currentDelay;
        Duration doubled = currentDelay.multipliedBy(2);
        currentDelay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        return delay;
    }

    /**
     * Restarts the sequence after a successful connection.
     */
    public void reset() {
        currentDelay = initialDelay;
    }

    /** Visible for tests */
    Duration peek() {
        return currentDelay;
    }
}
