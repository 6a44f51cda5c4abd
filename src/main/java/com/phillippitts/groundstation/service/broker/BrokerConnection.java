package com.phillippitts.groundstation.service.broker;

import com.phillippitts.groundstation.exception.BrokerConnectionException;

/**
 * One open connection to the broker. Created by {@link BrokerConnectionFactory} and owned
 * exclusively by {@link BrokerConnectionManager}.
 *
 * <p>Inbound messages are consumed by pulling with {@link #nextMessage()}, so the manager reads
 * them sequentially on its own thread.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Subscribes to a topic on this connection.
     *
     * @throws BrokerConnectionException if the broker rejects or the transport fails
     */
    void subscribe(String topic, int qos);

    /**
     * Publishes a payload.
     *
     * @throws BrokerConnectionException if the transport fails
     */
    void publish(String topic, byte[] payload, int qos);

    /**
     * Blocks until the next inbound message arrives.
     *
     * @return the next message, never null
     * @throws BrokerConnectionException when the connection is lost
     * @throws InterruptedException      when the calling thread is interrupted
     */
    InboundMessage nextMessage() throws InterruptedException;

    /**
     * Disconnects and releases resources. Safe to call more than once.
     */
    @Override
    void close();
}
