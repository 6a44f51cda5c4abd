package com.phillippitts.groundstation.service.health;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.service.broker.BrokerConnectionManager;
import com.phillippitts.groundstation.service.broker.ConnectionState;
import com.phillippitts.groundstation.service.session.SessionFixtures;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import com.phillippitts.groundstation.testutil.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BrokerHealthIndicatorTest {

    private BrokerConnectionManager manager;
    private SessionRegistry registry;
    private BrokerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        manager = mock(BrokerConnectionManager.class);
        registry = new SessionRegistry(new BrokerProperties());
        indicator = new BrokerHealthIndicator(manager, registry);
    }

    @Test
    void upWhileConnected() {
        when(manager.isConnected()).thenReturn(true);
        when(manager.getState()).thenReturn(ConnectionState.CONNECTED);
        SessionFixtures.configuredSession(new RecordingTransport("ws-1"), "kitchen", registry);
        registry.addSubscription("assistant/kitchen/output");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("state", "CONNECTED")
                .containsEntry("activeSessions", 1)
                .containsEntry("subscriptions", 2);
    }

    @Test
    void downWhileReconnecting() {
        when(manager.isConnected()).thenReturn(false);
        when(manager.getState()).thenReturn(ConnectionState.CONNECTING);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("state", "CONNECTING");
    }
}
