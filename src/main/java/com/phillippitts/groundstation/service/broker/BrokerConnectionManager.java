package com.phillippitts.groundstation.service.broker;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.exception.BrokerConnectionException;
import com.phillippitts.groundstation.exception.BrokerNotConnectedException;
import com.phillippitts.groundstation.service.session.SatelliteCloseReason;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single broker connection of the process.
 *
 * <p>A listener thread connects, restores every topic of the subscription set, then reads
 * inbound messages one at a time and hands them to the {@link InboundMessageHandler}. When
 * connecting or reading fails, every satellite session is closed with
 * {@link SatelliteCloseReason#UPSTREAM_UNAVAILABLE} (no session can make progress without the
 * broker), and the loop retries after an exponential backoff. The loop only ends at shutdown.
 *
 * <p><b>Thread Safety:</b> {@link #publish}, {@link #subscribe} and {@link #unsubscribe} may be
 * called from any thread. Subscription restore and {@link #subscribe} share one lock, so a topic
 * added while reconnecting is either part of the restore or subscribed live, never lost.
 */
@Component
public class BrokerConnectionManager {

    private static final Logger LOG = LogManager.getLogger(BrokerConnectionManager.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final BrokerConnectionFactory connectionFactory;
    private final SessionRegistry registry;
    private final InboundMessageHandler inboundHandler;
    private final BrokerProperties properties;
    private final ApplicationEventPublisher publisher;
    private final Executor listenerExecutor;
    private final ReconnectBackoff backoff;

    private final Lock connectionLock = new ReentrantLock();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile Sleeper sleeper = Sleeper.THREAD_SLEEP;
    private volatile BrokerConnection connection;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean running;
    private volatile Thread listenerThread;

    public BrokerConnectionManager(BrokerConnectionFactory connectionFactory,
                                   SessionRegistry registry,
                                   InboundMessageHandler inboundHandler,
                                   BrokerProperties properties,
                                   ApplicationEventPublisher publisher,
                                   @Qualifier("brokerListenerExecutor") Executor listenerExecutor) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.inboundHandler = Objects.requireNonNull(inboundHandler, "inboundHandler");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.listenerExecutor = Objects.requireNonNull(listenerExecutor, "listenerExecutor");
        this.backoff = new ReconnectBackoff(properties.getInitialReconnectDelay(), properties.getMaxReconnectDelay());
    }

    /**
     * Starts the connect/listen loop on the listener executor.
     */
    @PostConstruct
    public void start() {
        if (running) {
            return;
        }
        running = true;
        listenerExecutor.execute(this::runListenLoop);
    }

    /**
     * Stops the loop, closes the connection and waits for the listener thread to finish.
     */
    @PreDestroy
    public void stop() {
        running = false;
        Thread thread = listenerThread;
        if (thread != null) {
            thread.interrupt();
        }
        try {
            if (thread != null && thread != Thread.currentThread()
                    && !stopped.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Broker listener did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Broker connection manager stopped");
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * Publishes a UTF-8 payload with the configured QoS.
     *
     * @throws BrokerNotConnectedException if the broker is currently disconnected
     * @throws BrokerConnectionException   if the transport fails while publishing
     */
    public void publish(String topic, String payload) {
        BrokerConnection current = connection;
        if (state != ConnectionState.CONNECTED || current == null) {
            throw new BrokerNotConnectedException(topic);
        }
        current.publish(topic, payload.getBytes(StandardCharsets.UTF_8), properties.getQos());
        LOG.debug("Published {} bytes to {}", payload.length(), topic);
    }

    /**
     * Adds a topic to the subscription set and subscribes immediately when connected.
     * A failed live subscribe is logged; the next reconnect restores it.
     */
    public void subscribe(String topic) {
        connectionLock.lock();
        try {
            registry.addSubscription(topic);
            BrokerConnection current = connection;
            if (state != ConnectionState.CONNECTED || current == null) {
                LOG.debug("Broker disconnected; {} will be subscribed on reconnect", topic);
                return;
            }
            try {
                current.subscribe(topic, properties.getQos());
                LOG.debug("Subscribed to MQTT topic: {}", topic);
            } catch (BrokerConnectionException e) {
                LOG.warn("Live subscribe to {} failed, will retry on reconnect: {}", topic, e.getMessage());
            }
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Removes a topic from the subscription set. The broker-level subscription is kept until
     * the next reconnect; messages on it are dropped by the router.
     */
    public void unsubscribe(String topic) {
        if (registry.removeSubscription(topic)) {
            LOG.debug("Removed {} from tracked subscriptions", topic);
        }
    }

    /** Visible for tests */
    void setSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    void runListenLoop() {
        listenerThread = Thread.currentThread();
        try {
            while (running) {
                try {
                    connectAndListen();
                } catch (RuntimeException e) {
                    onConnectionFailure(e);
                    if (!running) {
                        break;
                    }
                    Duration delay = backoff.nextDelay();
                    LOG.error("MQTT connection lost: {}. Reconnecting in {} seconds...",
                            e.getMessage(), delay.toSeconds());
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Broker listener interrupted");
        } finally {
            disconnect(null);
            listenerThread = null;
            stopped.countDown();
        }
    }

    private void connectAndListen() throws InterruptedException {
        transition(ConnectionState.CONNECTING, null);
        LOG.info("Connecting to MQTT broker at {}:{}", properties.getHost(), properties.getPort());
        BrokerConnection opened = connectionFactory.open();

        connectionLock.lock();
        try {
            connection = opened;
            transition(ConnectionState.CONNECTED, null);
            for (String topic : registry.subscriptions()) {
                opened.subscribe(topic, properties.getQos());
                LOG.debug("Subscribed to MQTT topic: {}", topic);
            }
        } finally {
            connectionLock.unlock();
        }
        LOG.info("MQTT connected and subscriptions restored");
        backoff.reset();

        while (running) {
            inboundHandler.onMessage(opened.nextMessage());
        }
    }

    private void onConnectionFailure(RuntimeException cause) {
        disconnect(cause.getMessage());
        int closed = registry.closeAll(SatelliteCloseReason.UPSTREAM_UNAVAILABLE);
        if (closed > 0) {
            LOG.warn("Closed {} satellite session(s) after losing the broker", closed);
        }
    }

    private void disconnect(String reason) {
        connectionLock.lock();
        try {
            BrokerConnection current = connection;
            connection = null;
            if (current != null) {
                current.close();
            }
            transition(ConnectionState.DISCONNECTED, reason);
        } finally {
            connectionLock.unlock();
        }
    }

    private void transition(ConnectionState next, String reason) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        publisher.publishEvent(new BrokerConnectionStateChangedEvent(previous, next, Instant.now(), reason));
    }
}
