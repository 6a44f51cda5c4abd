package com.phillippitts.groundstation.service.broker;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.domain.ClientRequest;
import com.phillippitts.groundstation.exception.BrokerConnectionException;
import com.phillippitts.groundstation.exception.BrokerNotConnectedException;
import com.phillippitts.groundstation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Publishes user requests to the backend input topic.
 */
@Component
public class ClientRequestPublisher {

    private static final Logger LOG = LogManager.getLogger(ClientRequestPublisher.class);

    private final BrokerConnectionManager connectionManager;
    private final MessageCodec codec;
    private final BrokerProperties properties;

    public ClientRequestPublisher(BrokerConnectionManager connectionManager,
                                  MessageCodec codec,
                                  BrokerProperties properties) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Builds a request with a fresh id and publishes it.
     *
     * @return the published request
     * @throws BrokerNotConnectedException if the broker is disconnected
     * @throws BrokerConnectionException   if the publish fails on the transport
     */
    public ClientRequest publish(String text, String room, String outputTopic) {
        ClientRequest request = ClientRequest.of(text, room, outputTopic);
        connectionManager.publish(properties.getInputTopic(), codec.encode(request));
        LOG.info("Published request {} for room {}: {}", request.id(), room, LogSanitizer.preview(text));
        return request;
    }
}
