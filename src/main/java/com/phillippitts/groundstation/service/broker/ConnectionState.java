package com.phillippitts.groundstation.service.broker;

/**
 * Lifecycle of the broker connection:
 * {@code DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED → CONNECTING → ...}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
