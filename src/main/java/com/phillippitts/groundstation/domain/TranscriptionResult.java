package com.phillippitts.groundstation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Response of the speech-to-text service.
 *
 * <p>Note: Empty text is valid (silence may produce an empty transcription).
 *
 * @param text    the transcribed text (must not be null)
 * @param message service status message
 */
public record TranscriptionResult(String text, String message) {

    @JsonCreator
    public TranscriptionResult(@JsonProperty(value = "text", required = true) String text,
                               @JsonProperty(value = "message", required = true) String message) {
        this.text = Objects.requireNonNull(text, "Transcription text must not be null");
        this.message = Objects.requireNonNull(message, "Transcription message must not be null");
    }
}
