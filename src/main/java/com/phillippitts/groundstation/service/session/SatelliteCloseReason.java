package com.phillippitts.groundstation.service.session;

/**
 * Close statuses a satellite can tell apart. Codes follow RFC 6455 section 7.4.1.
 */
public enum SatelliteCloseReason {

    /** The connection identity is already registered. */
    DUPLICATE(1001, "Connection already exists"),

    /** The handshake frame was missing or malformed. */
    CONFIGURATION_ERROR(1002, "Invalid session configuration"),

    /** An unexpected failure inside the ground station. */
    INTERNAL_ERROR(1011, "Internal error"),

    /** The broker is unreachable; the satellite should reconnect later. */
    UPSTREAM_UNAVAILABLE(1013, "Upstream broker unavailable");

    private final int code;
    private final String reason;

    SatelliteCloseReason(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
