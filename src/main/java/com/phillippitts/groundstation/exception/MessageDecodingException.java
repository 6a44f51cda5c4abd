package com.phillippitts.groundstation.exception;

/**
 * Thrown when a broker payload is not valid UTF-8 or does not match the expected JSON shape.
 */
public class MessageDecodingException extends GroundStationException {

    public MessageDecodingException(String message) {
        super(message);
    }

    public MessageDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
