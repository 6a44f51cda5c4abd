package com.phillippitts.groundstation.testutil;

import com.phillippitts.groundstation.service.broker.BrokerConnectionStateChangedEvent;
import com.phillippitts.groundstation.service.broker.ConnectionState;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * Returns the sequence of connection states published so far.
     */
    public List<ConnectionState> connectionStates() {
        return events.stream()
                .filter(e -> e instanceof BrokerConnectionStateChangedEvent)
                .map(e -> ((BrokerConnectionStateChangedEvent) e).current())
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
