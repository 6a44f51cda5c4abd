package com.phillippitts.groundstation.service.session;

import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.exception.SessionConfigException;
import com.phillippitts.groundstation.service.broker.BrokerConnectionManager;
import com.phillippitts.groundstation.service.broker.ClientRequestPublisher;
import com.phillippitts.groundstation.service.broker.MessageCodec;
import com.phillippitts.groundstation.service.capture.ControlSignal;
import com.phillippitts.groundstation.service.capture.SatelliteAudioProcessor;
import com.phillippitts.groundstation.service.delivery.OutputDeliveryThrottle;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.speech.SpeechToTextClient;
import com.phillippitts.groundstation.service.speech.TextToSpeechClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Drives a satellite session from accept to teardown.
 *
 * <p><b>Sequence:</b>
 * <ol>
 *   <li>{@link #accept} registers the connection, unless the broker is down or the identity
 *       is taken</li>
 *   <li>{@link #configure} handles the handshake frame: binds the room's output topic,
 *       subscribes to it and starts the delivery loop</li>
 *   <li>{@link #onControlText} and {@link #onAudio} feed the capture state machine</li>
 *   <li>{@link #teardown} stops delivery and releases the route and, if no other session of
 *       the room remains, the subscription</li>
 * </ol>
 *
 * <p>Methods for one session are called sequentially by the transport. Failures stay inside
 * the session: nothing here throws back to the caller.
 */
@Component
public class SatelliteSessionLifecycle {

    private static final Logger LOG = LogManager.getLogger(SatelliteSessionLifecycle.class);

    private final SessionRegistry registry;
    private final BrokerConnectionManager connectionManager;
    private final MessageCodec codec;
    private final SpeechToTextClient speechToText;
    private final TextToSpeechClient textToSpeech;
    private final ClientRequestPublisher requestPublisher;
    private final SatelliteProperties properties;
    private final GroundStationMetrics metrics;
    private final Executor deliveryExecutor;

    public SatelliteSessionLifecycle(SessionRegistry registry,
                                     BrokerConnectionManager connectionManager,
                                     MessageCodec codec,
                                     SpeechToTextClient speechToText,
                                     TextToSpeechClient textToSpeech,
                                     ClientRequestPublisher requestPublisher,
                                     SatelliteProperties properties,
                                     GroundStationMetrics metrics,
                                     @Qualifier("deliveryExecutor") Executor deliveryExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.speechToText = Objects.requireNonNull(speechToText, "speechToText");
        this.textToSpeech = Objects.requireNonNull(textToSpeech, "textToSpeech");
        this.requestPublisher = Objects.requireNonNull(requestPublisher, "requestPublisher");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }

    /**
     * Registers a new connection.
     *
     * @return the session, or empty if the connection was rejected and closed
     */
    public Optional<SatelliteSession> accept(SatelliteTransport transport) {
        if (!connectionManager.isConnected()) {
            LOG.warn("Rejecting satellite {}: broker not connected", transport.id());
            transport.close(SatelliteCloseReason.UPSTREAM_UNAVAILABLE);
            return Optional.empty();
        }
        SatelliteSession session = new SatelliteSession(transport);
        if (!registry.register(session)) {
            LOG.warn("Rejecting satellite {}: connection already exists", transport.id());
            transport.close(SatelliteCloseReason.DUPLICATE);
            return Optional.empty();
        }
        LOG.info("Satellite {} connected", session.id());
        return Optional.of(session);
    }

    /**
     * Applies the handshake frame.
     *
     * @return {@code true} if the session is ready; otherwise it has been torn down and closed
     */
    public boolean configure(SatelliteSession session, String handshake) {
        SessionConfig config;
        try {
            config = codec.decodeSessionConfig(handshake);
        } catch (SessionConfigException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            abort(session, SatelliteCloseReason.CONFIGURATION_ERROR);
            return false;
        }

        SatelliteTransport transport = session.transport();
        SatelliteAudioProcessor processor = new SatelliteAudioProcessor(
                transport, config, speechToText, requestPublisher, properties, metrics);
        OutputDeliveryThrottle throttle = new OutputDeliveryThrottle(
                transport, session.deliveryQueue(), config.samplerate(), textToSpeech, properties, metrics);
        try {
            session.configure(config, processor, throttle);
            registry.bindOutputTopic(session);
            connectionManager.subscribe(config.outputTopic());
            throttle.start(deliveryExecutor);
        } catch (RuntimeException e) {
            LOG.error("Failed to set up satellite {}", session.id(), e);
            abort(session, SatelliteCloseReason.INTERNAL_ERROR);
            return false;
        }
        if (session.isTornDown()) {
            // teardown ran mid-setup (e.g. broker loss) and may have missed the loop or the topic
            undoSetup(session, config.outputTopic());
            return false;
        }
        LOG.info("Satellite {} configured for room {} (output topic {})",
                session.id(), config.room(), config.outputTopic());
        return true;
    }

    private void undoSetup(SatelliteSession session, String outputTopic) {
        LOG.warn("Satellite {} was torn down during setup, releasing it", session.id());
        session.deliveryThrottle().stop();
        registry.deregister(session).ifPresent(connectionManager::unsubscribe);
        if (!registry.hasRoute(outputTopic)) {
            connectionManager.unsubscribe(outputTopic);
        }
    }

    /**
     * Rejects a session whose first frame was not a handshake.
     */
    public void rejectHandshake(SatelliteSession session, String detail) {
        LOG.error("Configuration error: {}", detail);
        abort(session, SatelliteCloseReason.CONFIGURATION_ERROR);
    }

    /**
     * Routes a text frame received after the handshake. Unknown signals are ignored.
     */
    public void onControlText(SatelliteSession session, String text) {
        SatelliteAudioProcessor processor = session.audioProcessor();
        if (processor == null) {
            LOG.warn("Control frame before configuration on {}, ignoring", session.id());
            return;
        }
        Optional<ControlSignal> signal = ControlSignal.fromWire(text);
        if (signal.isEmpty()) {
            LOG.warn("Unknown control signal: {}", text);
            return;
        }
        processor.onControlSignal(signal.get());
    }

    public void onAudio(SatelliteSession session, byte[] chunk) {
        SatelliteAudioProcessor processor = session.audioProcessor();
        if (processor == null) {
            LOG.warn("Audio before configuration on {}, ignoring", session.id());
            return;
        }
        processor.onAudio(chunk);
    }

    /**
     * Tears the session down and closes its transport with the given status.
     */
    public void abort(SatelliteSession session, SatelliteCloseReason reason) {
        teardown(session);
        session.transport().close(reason);
    }

    /**
     * Stops delivery, deregisters the session and drops the room subscription once the room
     * has no session left. Runs once per session; later calls return immediately.
     */
    public void teardown(SatelliteSession session) {
        if (!session.markTornDown()) {
            return;
        }
        try {
            OutputDeliveryThrottle throttle = session.deliveryThrottle();
            if (throttle != null) {
                throttle.stop();
            }
            Optional<String> released = registry.deregister(session);
            released.ifPresent(connectionManager::unsubscribe);
            LOG.info("Satellite {} disconnected", session.id());
        } catch (RuntimeException e) {
            LOG.error("Error while tearing down satellite {}", session.id(), e);
        }
    }
}
