package com.phillippitts.groundstation.exception;

/**
 * Thrown when the broker connection cannot be opened, or fails while reading, subscribing
 * or publishing.
 */
public class BrokerConnectionException extends GroundStationException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
