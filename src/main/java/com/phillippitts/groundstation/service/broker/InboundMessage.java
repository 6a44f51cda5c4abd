package com.phillippitts.groundstation.service.broker;

import java.util.Objects;

/**
 * Message received from the broker, before decoding.
 *
 * @param topic   topic the message arrived on
 * @param payload raw payload bytes
 */
public record InboundMessage(String topic, byte[] payload) {

    public InboundMessage {
        Objects.requireNonNull(topic, "topic must not be null");
        payload = payload == null ? new byte[0] : payload;
    }
}
