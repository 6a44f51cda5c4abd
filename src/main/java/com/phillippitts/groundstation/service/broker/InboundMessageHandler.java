package com.phillippitts.groundstation.service.broker;

/**
 * Consumer of the broker's inbound stream. Called on the listener thread, one message at a
 * time, in arrival order. Implementations must not throw.
 */
@FunctionalInterface
public interface InboundMessageHandler {

    void onMessage(InboundMessage message);
}
