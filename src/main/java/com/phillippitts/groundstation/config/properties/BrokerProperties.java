package com.phillippitts.groundstation.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;

/**
 * Configuration properties for the MQTT broker connection and the topics the ground station uses.
 */
@Validated
@ConfigurationProperties(prefix = "groundstation.broker")
public class BrokerProperties {

    private static final String CLIENT_TOPIC_PREFIX = "assistant/ground_station/all/";

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 1883;

    /** Broker client id; defaults to the host name. */
    private String clientId;

    private String username;

    private String password;

    @Positive(message = "Connection timeout must be positive")
    private int connectionTimeoutSeconds = 10;

    @Positive(message = "Keep-alive interval must be positive")
    private int keepAliveSeconds = 60;

    /** Topic whose messages fan out to every satellite. */
    @NotBlank
    private String broadcastTopic = "assistant/broadcast";

    /** Optional override of the input topic; see {@link #getInputTopic()}. */
    private String inputTopic;

    @NotNull
    private Duration initialReconnectDelay = Duration.ofSeconds(5);

    @NotNull
    private Duration maxReconnectDelay = Duration.ofSeconds(60);

    /** Quality of service used for every subscription and publish. */
    @Min(0)
    @Max(2)
    private int qos = 1;

    /**
     * Returns the broker URI in Paho form, e.g. {@code tcp://localhost:1883}.
     */
    public String getServerUri() {
        return "tcp://" + host + ":" + port;
    }

    /**
     * Topic under which this ground station publishes: {@code assistant/ground_station/all/{clientId}}.
     */
    public String getClientTopic() {
        return CLIENT_TOPIC_PREFIX + getClientId();
    }

    /**
     * Topic every transcribed request is published to. Uses the configured override when set,
     * otherwise {@code {clientTopic}/input}.
     */
    public String getInputTopic() {
        if (inputTopic != null && !inputTopic.isBlank()) {
            return inputTopic;
        }
        return getClientTopic() + "/input";
    }

    public void setInputTopic(String inputTopic) {
        this.inputTopic = inputTopic;
    }

    public String getClientId() {
        if (clientId == null || clientId.isBlank()) {
            clientId = localHostName();
        }
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getConnectionTimeoutSeconds() {
        return connectionTimeoutSeconds;
    }

    public void setConnectionTimeoutSeconds(int connectionTimeoutSeconds) {
        this.connectionTimeoutSeconds = connectionTimeoutSeconds;
    }

    public int getKeepAliveSeconds() {
        return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
        this.keepAliveSeconds = keepAliveSeconds;
    }

    public String getBroadcastTopic() {
        return broadcastTopic;
    }

    public void setBroadcastTopic(String broadcastTopic) {
        this.broadcastTopic = broadcastTopic;
    }

    public Duration getInitialReconnectDelay() {
        return initialReconnectDelay;
    }

    public void setInitialReconnectDelay(Duration initialReconnectDelay) {
        this.initialReconnectDelay = initialReconnectDelay;
    }

    public Duration getMaxReconnectDelay() {
        return maxReconnectDelay;
    }

    public void setMaxReconnectDelay(Duration maxReconnectDelay) {
        this.maxReconnectDelay = maxReconnectDelay;
    }

    public int getQos() {
        return qos;
    }

    public void setQos(int qos) {
        this.qos = qos;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "ground-station";
        }
    }
}
