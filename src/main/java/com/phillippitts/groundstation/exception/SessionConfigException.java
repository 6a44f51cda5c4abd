package com.phillippitts.groundstation.exception;

/**
 * Thrown when the handshake frame of a satellite is missing or cannot be turned into a
 * {@link com.phillippitts.groundstation.domain.SessionConfig}.
 */
public class SessionConfigException extends GroundStationException {

    public SessionConfigException(String message) {
        super(message);
    }

    public SessionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
