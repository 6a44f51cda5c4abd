package com.phillippitts.groundstation.presentation.websocket;

import com.phillippitts.groundstation.service.session.SatelliteCloseReason;
import com.phillippitts.groundstation.service.session.SatelliteTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SatelliteTransport} over a Spring WebSocket session.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator}, so the reader thread
 * (error tones) and the delivery thread (speech) never write concurrently.
 */
public class WebSocketSatelliteTransport implements SatelliteTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketSatelliteTransport.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 4 * 1024 * 1024;

    private final WebSocketSession session;
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebSocketSatelliteTransport(WebSocketSession session) {
        Objects.requireNonNull(session, "session must not be null");
        this.session = session instanceof ConcurrentWebSocketSessionDecorator
                ? session
                : new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    @Override
    public void sendText(String text) throws IOException {
        send(new TextMessage(text));
    }

    @Override
    public void sendBinary(byte[] data) throws IOException {
        send(new BinaryMessage(data));
    }

    @Override
    public void close(SatelliteCloseReason reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            session.close(new CloseStatus(reason.code(), reason.reason()));
        } catch (IOException e) {
            LOG.debug("Closing satellite {} failed: {}", id(), e.getMessage());
        }
    }

    private void send(WebSocketMessage<?> message) throws IOException {
        if (!isOpen()) {
            throw new IOException("Satellite " + id() + " is closed");
        }
        try {
            session.sendMessage(message);
        } catch (SessionLimitExceededException e) {
            throw new IOException("Send to satellite " + id() + " exceeded limits", e);
        }
    }
}
