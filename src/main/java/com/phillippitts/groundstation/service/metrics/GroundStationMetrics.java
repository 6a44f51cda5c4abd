package com.phillippitts.groundstation.service.metrics;

import com.phillippitts.groundstation.service.broker.BrokerConnectionStateChangedEvent;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the bridge.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Broker messages routed to sessions and messages dropped, by reason</li>
 *   <li>Speech-to-text latency and outcomes</li>
 *   <li>Text-to-speech outcomes</li>
 *   <li>Broker connection state changes and active satellite sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
@Component
public class GroundStationMetrics {

    private static final String METRIC_PREFIX = "groundstation";

    private final MeterRegistry registry;

    public GroundStationMetrics(MeterRegistry registry, SessionRegistry sessionRegistry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", sessionRegistry, SessionRegistry::activeSessionCount)
                .description("Registered satellite sessions")
                .register(registry);
    }

    /**
     * Counts one broker message handed to session queues.
     *
     * @param route   {@code broadcast} or {@code direct}
     * @param targets number of queues that received it
     */
    public void recordRouted(String route, int targets) {
        Counter.builder(METRIC_PREFIX + ".broker.messages.routed")
                .description("Broker messages decoded and handed to the registry")
                .tag("route", route)
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".broker.messages.enqueued")
                .description("Session queue insertions")
                .tag("route", route)
                .register(registry)
                .increment(targets);
    }

    /**
     * Counts one dropped broker message.
     *
     * @param reason invalid_utf8, malformed or unroutable
     */
    public void recordDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".broker.messages.dropped")
                .description("Broker messages dropped before reaching a session")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSttLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stt.latency")
                .description("Time taken by the speech-to-text service")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSttSuccess() {
        Counter.builder(METRIC_PREFIX + ".stt.success")
                .description("Successful transcriptions")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (timeout, http_4xx, http_5xx, invalid_response, unexpected)
     */
    public void incrementSttFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".stt.failure")
                .description("Failed transcriptions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTtsSuccess() {
        Counter.builder(METRIC_PREFIX + ".tts.success")
                .description("Responses synthesized and sent")
                .register(registry)
                .increment();
    }

    public void incrementTtsFailure() {
        Counter.builder(METRIC_PREFIX + ".tts.failure")
                .description("Responses skipped because synthesis failed")
                .register(registry)
                .increment();
    }

    /** Publish failures of client requests, including publishes while disconnected. */
    public void incrementPublishFailure() {
        Counter.builder(METRIC_PREFIX + ".broker.publish.failure")
                .description("Client requests that could not be published")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onConnectionStateChanged(BrokerConnectionStateChangedEvent event) {
        Counter.builder(METRIC_PREFIX + ".broker.state.transitions")
                .description("Broker connection state changes")
                .tag("state", event.current().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
