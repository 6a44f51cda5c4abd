package com.phillippitts.groundstation.service.broker;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.exception.BrokerConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Opens MQTT connections with the Eclipse Paho client.
 *
 * <p>Paho delivers messages on its own callback thread. Each connection hands them over to a
 * queue that the listener thread drains, so routing never runs inside a Paho callback (where
 * a subscribe or publish call would deadlock).
 */
@Component
public class PahoBrokerConnectionFactory implements BrokerConnectionFactory {

    private static final Logger LOG = LogManager.getLogger(PahoBrokerConnectionFactory.class);

    private final BrokerProperties properties;

    public PahoBrokerConnectionFactory(BrokerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public BrokerConnection open() {
        MqttClient client;
        try {
            client = new MqttClient(properties.getServerUri(), properties.getClientId(), new MemoryPersistence());
        } catch (MqttException e) {
            throw new BrokerConnectionException("Invalid broker client settings for " + properties.getServerUri(), e);
        }

        PahoBrokerConnection connection = new PahoBrokerConnection(client);
        client.setCallback(connection);
        try {
            client.connect(connectOptions());
        } catch (MqttException e) {
            connection.close();
            throw new BrokerConnectionException("Cannot connect to broker at " + properties.getServerUri(), e);
        }
        LOG.debug("Paho client {} connected to {}", properties.getClientId(), properties.getServerUri());
        return connection;
    }

    MqttConnectOptions connectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setConnectionTimeout(properties.getConnectionTimeoutSeconds());
        options.setKeepAliveInterval(properties.getKeepAliveSeconds());
        if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            options.setUserName(properties.getUsername());
            String password = properties.getPassword();
            if (password != null) {
                options.setPassword(password.toCharArray());
            }
        }
        return options;
    }

    /**
     * Paho-backed connection. Connection loss is queued behind any messages already received,
     * so the listener sees every delivered message before the failure.
     */
    static final class PahoBrokerConnection implements BrokerConnection, MqttCallback {

        private final MqttClient client;
        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

        PahoBrokerConnection(MqttClient client) {
            this.client = client;
        }

        @Override
        public void subscribe(String topic, int qos) {
            try {
                client.subscribe(topic, qos);
            } catch (MqttException e) {
                throw new BrokerConnectionException("Subscribe to " + topic + " failed", e);
            }
        }

        @Override
        public void publish(String topic, byte[] payload, int qos) {
            try {
                client.publish(topic, payload, qos, false);
            } catch (MqttException e) {
                throw new BrokerConnectionException("Publish to " + topic + " failed", e);
            }
        }

        @Override
        public InboundMessage nextMessage() throws InterruptedException {
            Object next = inbound.take();
            if (next instanceof Throwable cause) {
                // keep the marker so repeated reads keep failing
                inbound.offer(cause);
                throw new BrokerConnectionException("Connection to broker lost: " + cause.getMessage(), cause);
            }
            return (InboundMessage) next;
        }

        @Override
        public void close() {
            try {
                if (client.isConnected()) {
                    client.disconnect();
                }
            } catch (MqttException e) {
                LOG.debug("Disconnect failed: {}", e.toString());
            }
            try {
                client.close();
            } catch (MqttException e) {
                LOG.debug("Closing Paho client failed: {}", e.toString());
            }
        }

        @Override
        public void connectionLost(Throwable cause) {
            inbound.offer(cause == null ? new IllegalStateException("connection lost") : cause);
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            inbound.offer(new InboundMessage(topic, message.getPayload()));
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // QoS acknowledgements need no handling
        }
    }
}
