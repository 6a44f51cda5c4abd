package com.phillippitts.groundstation.service.session;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.domain.SessionConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide tables of the ground station: registered sessions, output topic routes and the
 * broker subscription set.
 *
 * <p><b>Thread Safety:</b> All three tables are guarded by a single {@link ReentrantLock}.
 * No foreign code (transport I/O, broker calls) runs while it is held, so callers may take it
 * while holding their own locks.
 *
 * <p><b>Routing:</b> a route maps an output topic to the delivery queues of every session in
 * that room. The broadcast topic has no route of its own; it reaches every queue reachable from
 * a topic ending in {@value SessionConfig#OUTPUT_TOPIC_SUFFIX}. Enqueueing happens under the
 * lock, so once {@link #deregister(SatelliteSession)} returns no message reaches that session.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Lock lock = new ReentrantLock();
    private final Map<String, SatelliteSession> sessions = new LinkedHashMap<>();
    private final Map<String, Set<BlockingQueue<BrokerMessage>>> routes = new LinkedHashMap<>();
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private final String broadcastTopic;

    public SessionRegistry(BrokerProperties brokerProperties) {
        this.broadcastTopic = brokerProperties.getBroadcastTopic();
        this.subscriptions.add(broadcastTopic);
    }

    public String broadcastTopic() {
        return broadcastTopic;
    }

    /**
     * Registers a newly accepted session.
     *
     * @return {@code false} if a session with the same id is already registered; the existing
     *         session is left untouched
     */
    public boolean register(SatelliteSession session) {
        lock.lock();
        try {
            if (sessions.containsKey(session.id())) {
                return false;
            }
            sessions.put(session.id(), session);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Routes the session's output topic to its delivery queue.
     *
     * @throws IllegalStateException if the session is not configured or no longer registered
     */
    public void bindOutputTopic(SatelliteSession session) {
        SessionConfig config = session.config();
        if (config == null) {
            throw new IllegalStateException("Session " + session.id() + " has no configuration");
        }
        lock.lock();
        try {
            if (sessions.get(session.id()) != session) {
                throw new IllegalStateException("Session " + session.id() + " is not registered");
            }
            routes.computeIfAbsent(config.outputTopic(), topic -> new LinkedHashSet<>())
                    .add(session.deliveryQueue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the session and its route. Safe to call repeatedly.
     *
     * @return the output topic that no longer has any session routed to it, if any; the caller
     *         should drop it from the broker subscriptions
     */
    public Optional<String> deregister(SatelliteSession session) {
        lock.lock();
        try {
            if (sessions.get(session.id()) == session) {
                sessions.remove(session.id());
            }
            SessionConfig config = session.config();
            if (config == null) {
                return Optional.empty();
            }
            Set<BlockingQueue<BrokerMessage>> queues = routes.get(config.outputTopic());
            if (queues == null || !queues.remove(session.deliveryQueue())) {
                return Optional.empty();
            }
            if (queues.isEmpty()) {
                routes.remove(config.outputTopic());
                return Optional.of(config.outputTopic());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String sessionId) {
        lock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public int activeSessionCount() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns {@code true} if at least one session is routed to the topic.
     */
    public boolean hasRoute(String topic) {
        lock.lock();
        try {
            return routes.containsKey(topic);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a message on every queue routed to the topic.
     *
     * @return number of queues the message was added to; 0 if the route disappeared
     */
    public int deliver(String topic, BrokerMessage message) {
        lock.lock();
        try {
            Set<BlockingQueue<BrokerMessage>> queues = routes.get(topic);
            if (queues == null) {
                return 0;
            }
            queues.forEach(queue -> queue.offer(message));
            return queues.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a message on every distinct queue reachable from an output topic.
     *
     * @return number of queues the message was added to
     */
    public int broadcast(BrokerMessage message) {
        lock.lock();
        try {
            Set<BlockingQueue<BrokerMessage>> targets = new LinkedHashSet<>();
            routes.forEach((topic, queues) -> {
                if (topic.endsWith(SessionConfig.OUTPUT_TOPIC_SUFFIX)) {
                    targets.addAll(queues);
                }
            });
            targets.forEach(queue -> queue.offer(message));
            return targets.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a topic to the subscription set.
     *
     * @return {@code true} if the topic was not yet present
     */
    public boolean addSubscription(String topic) {
        lock.lock();
        try {
            return subscriptions.add(topic);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a topic from the subscription set. The broadcast topic is permanent.
     *
     * @return {@code true} if the topic was removed
     */
    public boolean removeSubscription(String topic) {
        if (broadcastTopic.equals(topic)) {
            LOG.debug("Ignoring request to drop the broadcast subscription");
            return false;
        }
        lock.lock();
        try {
            return subscriptions.remove(topic);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the subscription set in insertion order.
     */
    public List<String> subscriptions() {
        lock.lock();
        try {
            return new ArrayList<>(subscriptions);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the transport of every registered session. Registry entries are removed by each
     * session's own teardown, triggered by the close.
     *
     * @return number of sessions closed
     */
    public int closeAll(SatelliteCloseReason reason) {
        List<SatelliteSession> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        for (SatelliteSession session : snapshot) {
            LOG.info("Closing satellite session {} ({})", session.id(), reason.reason());
            session.transport().close(reason);
        }
        return snapshot.size();
    }
}
