package com.phillippitts.groundstation.exception;

/**
 * Base exception for all ground station application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class GroundStationException extends RuntimeException {

    public GroundStationException(String message) {
        super(message);
    }

    public GroundStationException(String message, Throwable cause) {
        super(message, cause);
    }

    public GroundStationException(Throwable cause) {
        super(cause);
    }
}
