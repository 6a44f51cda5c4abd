package com.phillippitts.groundstation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Response published by the backend for one room or for every satellite.
 *
 * <p>Wire form: {@code {"text": "...", "alert": {"play_before": true} | null}}.
 *
 * @param text  text to synthesize (never null, may be empty)
 * @param alert optional alert settings, {@code null} when absent
 */
public record BrokerMessage(String text, Alert alert) {

    @JsonCreator
    public BrokerMessage(@JsonProperty(value = "text", required = true) String text,
                         @JsonProperty("alert") Alert alert) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.alert = alert;
    }

    /**
     * Returns {@code true} when an alert cue must be played before the spoken text.
     */
    public boolean playAlertBefore() {
        return alert != null && alert.playBefore();
    }

    /**
     * Alert settings attached to a response.
     *
     * @param playBefore play the alert cue before the synthesized speech
     */
    public record Alert(@JsonProperty("play_before") boolean playBefore) {

        @JsonCreator
        public Alert {
        }
    }
}
