package com.phillippitts.groundstation.service.health;

import com.phillippitts.groundstation.service.broker.BrokerConnectionManager;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the broker connection.
 *
 * <p>UP while connected, DOWN while disconnected or reconnecting. Exposed via
 * /actuator/health.
 */
@Component
public class BrokerHealthIndicator implements HealthIndicator {

    private final BrokerConnectionManager connectionManager;
    private final SessionRegistry registry;

    public BrokerHealthIndicator(BrokerConnectionManager connectionManager, SessionRegistry registry) {
        this.connectionManager = connectionManager;
        this.registry = registry;
    }

    @Override
    public Health health() {
        Health.Builder builder = connectionManager.isConnected() ? Health.up() : Health.down();
        return builder
                .withDetail("state", connectionManager.getState().name())
                .withDetail("activeSessions", registry.activeSessionCount())
                .withDetail("subscriptions", registry.subscriptions().size())
                .build();
    }
}
