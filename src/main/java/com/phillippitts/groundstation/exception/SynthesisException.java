package com.phillippitts.groundstation.exception;

/**
 * Thrown when the text-to-speech service fails or returns unusable audio.
 */
public class SynthesisException extends GroundStationException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
