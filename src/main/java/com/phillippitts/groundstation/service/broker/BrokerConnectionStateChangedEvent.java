package com.phillippitts.groundstation.service.broker;

import java.time.Instant;

/**
 * Published whenever the broker connection changes state.
 *
 * @param previous state before the change
 * @param current  state after the change
 * @param at       when the change happened
 * @param reason   failure description for transitions to DISCONNECTED, otherwise null
 */
public record BrokerConnectionStateChangedEvent(
        ConnectionState previous,
        ConnectionState current,
        Instant at,
        String reason
) {
    public BrokerConnectionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
