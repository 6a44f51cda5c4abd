package com.phillippitts.groundstation.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Transcribed user request published to the backend input topic.
 *
 * @param id          unique request id
 * @param text        transcribed or typed text
 * @param room        room the request originated from
 * @param outputTopic topic the backend should answer on
 */
public record ClientRequest(
        @JsonProperty("id") UUID id,
        @JsonProperty("text") String text,
        @JsonProperty("room") String room,
        @JsonProperty("output_topic") String outputTopic
) {

    public ClientRequest {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(room, "room must not be null");
        Objects.requireNonNull(outputTopic, "outputTopic must not be null");
    }

    /**
     * Creates a request with a random id.
     */
    public static ClientRequest of(String text, String room, String outputTopic) {
        return new ClientRequest(UUID.randomUUID(), text, room, outputTopic);
    }
}
