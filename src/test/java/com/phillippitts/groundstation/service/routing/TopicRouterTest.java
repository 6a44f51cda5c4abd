package com.phillippitts.groundstation.service.routing;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.service.broker.InboundMessage;
import com.phillippitts.groundstation.service.broker.MessageCodec;
import com.phillippitts.groundstation.service.metrics.GroundStationMetrics;
import com.phillippitts.groundstation.service.session.SatelliteSession;
import com.phillippitts.groundstation.service.session.SessionFixtures;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import com.phillippitts.groundstation.testutil.RecordingTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TopicRouterTest {

    private static final String BROADCAST = "assistant/broadcast";
    private static final String KITCHEN = "assistant/kitchen/output";

    private SessionRegistry registry;
    private MeterRegistry meters;
    private TopicRouter router;

    @BeforeEach
    void setUp() {
        BrokerProperties properties = new BrokerProperties();
        properties.setClientId("test-station");
        registry = new SessionRegistry(properties);
        meters = new SimpleMeterRegistry();
        router = new TopicRouter(registry, new MessageCodec(), new GroundStationMetrics(meters, registry));
    }

    @Test
    void broadcastWithoutSessionsIsANoOp() {
        assertThatCode(() -> router.onMessage(inbound(BROADCAST, "{\"text\":\"hello\"}")))
                .doesNotThrowAnyException();

        assertThat(meters.find("groundstation.broker.messages.routed").tag("route", "broadcast")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void broadcastReachesSingleSession() {
        SatelliteSession kitchen = session("ws-1", "kitchen");

        router.onMessage(inbound(BROADCAST, "{\"text\":\"hello\"}"));

        assertThat(kitchen.deliveryQueue()).extracting(BrokerMessage::text).containsExactly("hello");
    }

    @Test
    void broadcastReachesEveryRoom() {
        SatelliteSession kitchen = session("ws-1", "kitchen");
        SatelliteSession office = session("ws-2", "office");

        router.onMessage(inbound(BROADCAST, "{\"text\":\"dinner\",\"alert\":{\"play_before\":true}}"));

        assertThat(kitchen.deliveryQueue()).singleElement().satisfies(m -> assertThat(m.playAlertBefore()).isTrue());
        assertThat(office.deliveryQueue()).singleElement().satisfies(m -> assertThat(m.text()).isEqualTo("dinner"));
    }

    @Test
    void directMessageReachesOnlyItsRoom() {
        SatelliteSession kitchen = session("ws-1", "kitchen");
        SatelliteSession office = session("ws-2", "office");

        router.onMessage(inbound(KITCHEN, "{\"text\":\"timer set\"}"));

        assertThat(kitchen.deliveryQueue()).extracting(BrokerMessage::text).containsExactly("timer set");
        assertThat(office.deliveryQueue()).isEmpty();
    }

    @Test
    void keepsArrivalOrderPerTopic() {
        SatelliteSession kitchen = session("ws-1", "kitchen");

        router.onMessage(inbound(KITCHEN, "{\"text\":\"one\"}"));
        router.onMessage(inbound(KITCHEN, "{\"text\":\"two\"}"));
        router.onMessage(inbound(KITCHEN, "{\"text\":\"three\"}"));

        assertThat(kitchen.deliveryQueue()).extracting(BrokerMessage::text).containsExactly("one", "two", "three");
    }

    @Test
    void dropsMessageForUnknownTopic() {
        SatelliteSession kitchen = session("ws-1", "kitchen");

        router.onMessage(inbound("assistant/garage/output", "{\"text\":\"nobody home\"}"));

        assertThat(kitchen.deliveryQueue()).isEmpty();
        assertThat(meters.find("groundstation.broker.messages.dropped").tag("reason", "unroutable")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void dropsMalformedMessage() {
        SatelliteSession kitchen = session("ws-1", "kitchen");

        router.onMessage(inbound(KITCHEN, "{\"alert\":null}"));
        router.onMessage(inbound(BROADCAST, "not json"));

        assertThat(kitchen.deliveryQueue()).isEmpty();
        assertThat(meters.find("groundstation.broker.messages.dropped").tag("reason", "malformed")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void dropsInvalidUtf8() {
        SatelliteSession kitchen = session("ws-1", "kitchen");

        router.onMessage(new InboundMessage(KITCHEN, new byte[]{(byte) 0xFF, (byte) 0xFE}));

        assertThat(kitchen.deliveryQueue()).isEmpty();
        assertThat(meters.find("groundstation.broker.messages.dropped").tag("reason", "invalid_utf8")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void messageAfterDeregistrationIsDropped() {
        SatelliteSession kitchen = session("ws-1", "kitchen");
        registry.deregister(kitchen);

        router.onMessage(inbound(KITCHEN, "{\"text\":\"late\"}"));

        assertThat(kitchen.deliveryQueue()).isEmpty();
    }

    private SatelliteSession session(String id, String room) {
        return SessionFixtures.configuredSession(new RecordingTransport(id), room, registry);
    }

    private static InboundMessage inbound(String topic, String payload) {
        return new InboundMessage(topic, payload.getBytes(StandardCharsets.UTF_8));
    }
}
