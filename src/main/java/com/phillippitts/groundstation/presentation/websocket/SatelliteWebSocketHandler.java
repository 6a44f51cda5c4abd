package com.phillippitts.groundstation.presentation.websocket;

import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.service.session.SatelliteCloseReason;
import com.phillippitts.groundstation.service.session.SatelliteSession;
import com.phillippitts.groundstation.service.session.SatelliteSessionLifecycle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.ByteBuffer;

/**
 * WebSocket endpoint for satellites.
 *
 * <p>The first frame must be the JSON handshake; afterwards text frames are control signals
 * and binary frames are PCM16LE audio. Frames of one session arrive sequentially.
 * Log lines written while handling a frame carry {@code sessionId} and {@code room}.
 */
@Component
public class SatelliteWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(SatelliteWebSocketHandler.class);

    static final String SESSION_ATTRIBUTE = "groundstation.satellite";

    private final SatelliteSessionLifecycle lifecycle;

    public SatelliteWebSocketHandler(SatelliteSessionLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocket) {
        ThreadContext.put("sessionId", webSocket.getId());
        try {
            lifecycle.accept(new WebSocketSatelliteTransport(webSocket))
                    .ifPresent(session -> webSocket.getAttributes().put(SESSION_ATTRIBUTE, session));
        } finally {
            ThreadContext.clearAll();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocket, TextMessage message) {
        SatelliteSession session = sessionOf(webSocket);
        if (session == null) {
            return;
        }
        enterContext(session);
        try {
            if (!session.isConfigured()) {
                if (lifecycle.configure(session, message.getPayload())) {
                    ThreadContext.put("room", session.config().room());
                }
            } else {
                lifecycle.onControlText(session, message.getPayload());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error handling text frame", e);
            lifecycle.abort(session, SatelliteCloseReason.INTERNAL_ERROR);
        } finally {
            ThreadContext.clearAll();
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession webSocket, BinaryMessage message) {
        SatelliteSession session = sessionOf(webSocket);
        if (session == null) {
            return;
        }
        enterContext(session);
        try {
            if (!session.isConfigured()) {
                lifecycle.rejectHandshake(session, "expected a JSON handshake, got a binary frame");
                return;
            }
            lifecycle.onAudio(session, toBytes(message.getPayload()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected error handling audio frame", e);
            lifecycle.abort(session, SatelliteCloseReason.INTERNAL_ERROR);
        } finally {
            ThreadContext.clearAll();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocket, Throwable exception) {
        SatelliteSession session = sessionOf(webSocket);
        LOG.warn("Transport error on satellite {}: {}", webSocket.getId(), exception.getMessage());
        if (session != null) {
            lifecycle.teardown(session);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocket, CloseStatus status) {
        SatelliteSession session = sessionOf(webSocket);
        if (session == null) {
            return;
        }
        enterContext(session);
        try {
            LOG.debug("Satellite closed with {}", status);
            lifecycle.teardown(session);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static SatelliteSession sessionOf(WebSocketSession webSocket) {
        Object attribute = webSocket.getAttributes().get(SESSION_ATTRIBUTE);
        return attribute instanceof SatelliteSession session ? session : null;
    }

    private static void enterContext(SatelliteSession session) {
        ThreadContext.put("sessionId", session.id());
        SessionConfig config = session.config();
        if (config != null) {
            ThreadContext.put("room", config.room());
        }
    }

    private static byte[] toBytes(ByteBuffer payload) {
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        return bytes;
    }
}
