package com.phillippitts.groundstation.service.routing;

import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.exception.MessageDecodingException;
import com.phillippitts.groundstation.service.broker.InboundMessage;
import com.phillippitts.groundstation.service.broker.InboundMessageHandler;
import com.phillippitts.groundstation.service.broker.MessageCodec;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Routes inbound broker messages to the delivery queues of satellite sessions.
 *
 * <p>Runs on the broker listener thread, one message at a time, so arrival order per topic is
 * kept. Broadcast messages go to every session; other topics go to the sessions routed to
 * them. Undecodable and unroutable messages are logged and dropped. Nothing is thrown back
 * to the listener.
 */
@Component
public class TopicRouter implements InboundMessageHandler {

    private static final Logger LOG = LogManager.getLogger(TopicRouter.class);

    static final String ROUTE_BROADCAST = "broadcast";
    static final String ROUTE_DIRECT = "direct";

    private final SessionRegistry registry;
    private final MessageCodec codec;
    private final GroundStationMetrics metrics;

    public TopicRouter(SessionRegistry registry, MessageCodec codec, GroundStationMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onMessage(InboundMessage inbound) {
        String topic = inbound.topic();
        String payload;
        try {
            payload = codec.decodeText(inbound.payload());
        } catch (MessageDecodingException e) {
            metrics.recordDropped("invalid_utf8");
            LOG.error("Dropping message on {}: {}", topic, e.getMessage());
            return;
        }

        if (registry.broadcastTopic().equals(topic)) {
            BrokerMessage message = decode(topic, payload);
            if (message == null) {
                return;
            }
            int targets = registry.broadcast(message);
            metrics.recordRouted(ROUTE_BROADCAST, targets);
            if (targets == 0) {
                LOG.debug("Broadcast received with no satellites connected");
            } else {
                LOG.debug("Broadcast queued for {} session(s)", targets);
            }
            return;
        }

        if (!registry.hasRoute(topic)) {
            metrics.recordDropped("unroutable");
            LOG.warn("No output queue found for topic {}", topic);
            return;
        }
        BrokerMessage message = decode(topic, payload);
        if (message == null) {
            return;
        }
        int targets = registry.deliver(topic, message);
        if (targets == 0) {
            // session left between lookup and delivery
            metrics.recordDropped("unroutable");
            LOG.warn("Output queue for topic {} disappeared before delivery", topic);
            return;
        }
        metrics.recordRouted(ROUTE_DIRECT, targets);
        LOG.debug("Message on {} queued for {} session(s)", topic, targets);
    }

    private BrokerMessage decode(String topic, String payload) {
        try {
            return codec.decodeBrokerMessage(payload);
        } catch (MessageDecodingException e) {
            metrics.recordDropped("malformed");
            LOG.error("Message failed validation on {}: {}", topic, e.getMessage());
            return null;
        }
    }
}
