package com.phillippitts.groundstation.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audio and routing settings a satellite sends once, right after connecting.
 *
 * <p>The output topic is never taken from the satellite; it is derived from the room
 * (see {@link #outputTopicFor(String)}).
 *
 * @param samplerate     sample rate of captured and played audio in Hz
 * @param inputChannels  microphone channel count
 * @param outputChannels speaker channel count
 * @param chunkSize      frames per audio chunk sent by the satellite
 * @param room           room the satellite is placed in (non-blank, one topic level)
 * @param outputTopic    broker topic carrying responses for the room
 */
public record SessionConfig(
        int samplerate,
        int inputChannels,
        int outputChannels,
        int chunkSize,
        String room,
        String outputTopic
) {

    /** Suffix shared by every per-room output topic. */
    public static final String OUTPUT_TOPIC_SUFFIX = "/output";

    private static final String OUTPUT_TOPIC_PREFIX = "assistant/";

    // level separator, MQTT wildcards and NUL
    private static final String ILLEGAL_ROOM_CHARS = "/+#\0";

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if a numeric field is not positive, or the room is blank
     *                                  or contains a topic separator, wildcard or NUL
     */
    public SessionConfig {
        requirePositive(samplerate, "samplerate");
        requirePositive(inputChannels, "input_channels");
        requirePositive(outputChannels, "output_channels");
        requirePositive(chunkSize, "chunk_size");
        if (room == null || room.isBlank()) {
            throw new IllegalArgumentException("room must not be blank");
        }
        if (room.chars().anyMatch(c -> ILLEGAL_ROOM_CHARS.indexOf(c) >= 0)) {
            throw new IllegalArgumentException("room must be a single topic level without wildcards: " + room);
        }
        if (outputTopic == null) {
            outputTopic = outputTopicFor(room);
        }
    }

    /**
     * Creator used when decoding the satellite handshake; ignores any satellite-supplied topic.
     */
    @JsonCreator
    public static SessionConfig fromSatellite(
            @JsonProperty(value = "samplerate", required = true) int samplerate,
            @JsonProperty(value = "input_channels", required = true) int inputChannels,
            @JsonProperty(value = "output_channels", required = true) int outputChannels,
            @JsonProperty(value = "chunk_size", required = true) int chunkSize,
            @JsonProperty(value = "room", required = true) String room) {
        return new SessionConfig(samplerate, inputChannels, outputChannels, chunkSize, room, null);
    }

    /**
     * Derives the output topic of a room: {@code assistant/{room}/output}.
     */
    public static String outputTopicFor(String room) {
        return OUTPUT_TOPIC_PREFIX + room + OUTPUT_TOPIC_SUFFIX;
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got: " + value);
        }
    }
}
