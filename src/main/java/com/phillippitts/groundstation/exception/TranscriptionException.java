package com.phillippitts.groundstation.exception;

/**
 * Thrown when the speech-to-text service cannot transcribe a command.
 * This may occur due to timeouts, HTTP errors, or a response that fails validation.
 */
public class TranscriptionException extends GroundStationException {

    private final int statusCode;

    public TranscriptionException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public TranscriptionException(String message, int statusCode, Throwable cause) {
        super(message + " (status: " + statusCode + ")", cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the service, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
