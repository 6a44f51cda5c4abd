package com.phillippitts.groundstation.exception;

/**
 * Thrown when a request to the text endpoint carries a missing or wrong {@code user-token}.
 */
public class InvalidTokenException extends GroundStationException {

    public InvalidTokenException() {
        super("Invalid or missing user token");
    }
}
