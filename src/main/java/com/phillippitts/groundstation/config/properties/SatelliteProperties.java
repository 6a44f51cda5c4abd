package com.phillippitts.groundstation.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for satellite sessions: capture limits, output throttling and the
 * text-ingestion endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "groundstation.satellite")
public class SatelliteProperties {

    /** Longest command a satellite may record before the buffer is flushed. */
    @Positive(message = "Max command input seconds must be positive")
    private int maxCommandInputSeconds = 30;

    /** Hard cap on buffered audio bytes per command. */
    @Positive(message = "Max buffer bytes must be positive")
    private int maxBufferBytes = 1024 * 1024;

    /** Messages sent per drain activation. */
    @Positive(message = "Delivery batch size must be positive")
    private int deliveryBatchSize = 3;

    /** Pause between drain activations while the queue is empty. */
    @NotNull
    private Duration deliveryIdlePause = Duration.ofMillis(10);

    /** Upper bound on waiting for a drain task to stop during teardown. */
    @NotNull
    private Duration deliveryStopTimeout = Duration.ofSeconds(5);

    /** Connection limit reported by the readiness endpoint. */
    @Positive
    private int maxConnections = 50;

    /** Text frame sent to a satellite before an alerted response. */
    @NotBlank
    private String alertCue = "alert_default";

    /** Token expected in the {@code user-token} header of the text endpoint. */
    @NotBlank
    private String textEndpointToken = "DEBUG";

    public int getMaxCommandInputSeconds() {
        return maxCommandInputSeconds;
    }

    public void setMaxCommandInputSeconds(int maxCommandInputSeconds) {
        this.maxCommandInputSeconds = maxCommandInputSeconds;
    }

    public int getMaxBufferBytes() {
        return maxBufferBytes;
    }

    public void setMaxBufferBytes(int maxBufferBytes) {
        this.maxBufferBytes = maxBufferBytes;
    }

    public int getDeliveryBatchSize() {
        return deliveryBatchSize;
    }

    public void setDeliveryBatchSize(int deliveryBatchSize) {
        this.deliveryBatchSize = deliveryBatchSize;
    }

    public Duration getDeliveryIdlePause() {
        return deliveryIdlePause;
    }

    public void setDeliveryIdlePause(Duration deliveryIdlePause) {
        this.deliveryIdlePause = deliveryIdlePause;
    }

    public Duration getDeliveryStopTimeout() {
        return deliveryStopTimeout;
    }

    public void setDeliveryStopTimeout(Duration deliveryStopTimeout) {
        this.deliveryStopTimeout = deliveryStopTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public String getAlertCue() {
        return alertCue;
    }

    public void setAlertCue(String alertCue) {
        this.alertCue = alertCue;
    }

    public String getTextEndpointToken() {
        return textEndpointToken;
    }

    public void setTextEndpointToken(String textEndpointToken) {
        this.textEndpointToken = textEndpointToken;
    }
}
