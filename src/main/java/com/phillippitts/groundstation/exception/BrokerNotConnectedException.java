package com.phillippitts.groundstation.exception;

/**
 * Thrown when a publish is attempted while the broker connection is down.
 * Callers treat it as transient: the connection manager keeps reconnecting in the background.
 */
public class BrokerNotConnectedException extends GroundStationException {

    private final String topic;

    public BrokerNotConnectedException(String topic) {
        super("Broker not connected; cannot publish to " + topic);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
