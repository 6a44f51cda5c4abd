package com.phillippitts.groundstation.service.session;

import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.service.capture.SatelliteAudioProcessor;
import com.phillippitts.groundstation.service.delivery.OutputDeliveryThrottle;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one connected satellite, from accept until teardown.
 *
 * <p>The configuration, capture processor and delivery throttle are attached once, when the
 * handshake succeeds; until then {@link #isConfigured()} is {@code false}.
 */
public final class SatelliteSession {

    private final String id;
    private final SatelliteTransport transport;
    private final BlockingQueue<BrokerMessage> deliveryQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean tornDown = new AtomicBoolean();

    private volatile SessionConfig config;
    private volatile SatelliteAudioProcessor audioProcessor;
    private volatile OutputDeliveryThrottle deliveryThrottle;

    public SatelliteSession(SatelliteTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.id = transport.id();
    }

    public String id() {
        return id;
    }

    public SatelliteTransport transport() {
        return transport;
    }

    public BlockingQueue<BrokerMessage> deliveryQueue() {
        return deliveryQueue;
    }

    public SessionConfig config() {
        return config;
    }

    public SatelliteAudioProcessor audioProcessor() {
        return audioProcessor;
    }

    public OutputDeliveryThrottle deliveryThrottle() {
        return deliveryThrottle;
    }

    public boolean isConfigured() {
        return config != null;
    }

    /**
     * Attaches the handshake result and the per-session workers.
     *
     * @throws IllegalStateException if the session is already configured
     */
    void configure(SessionConfig config, SatelliteAudioProcessor audioProcessor,
                   OutputDeliveryThrottle deliveryThrottle) {
        if (this.config != null) {
            throw new IllegalStateException("Session " + id + " is already configured");
        }
        this.audioProcessor = Objects.requireNonNull(audioProcessor, "audioProcessor");
        this.deliveryThrottle = Objects.requireNonNull(deliveryThrottle, "deliveryThrottle");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Marks the session as torn down.
     *
     * @return {@code true} only for the first caller
     */
    boolean markTornDown() {
        return tornDown.compareAndSet(false, true);
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    @Override
    public String toString() {
        SessionConfig current = config;
        return "SatelliteSession[id=" + id + ", room=" + (current == null ? "-" : current.room()) + "]";
    }
}
