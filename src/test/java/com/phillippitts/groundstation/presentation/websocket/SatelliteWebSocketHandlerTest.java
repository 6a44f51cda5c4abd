package com.phillippitts.groundstation.presentation.websocket;

import com.phillippitts.groundstation.config.properties.BrokerProperties;
import com.phillippitts.groundstation.service.session.SatelliteCloseReason;
import com.phillippitts.groundstation.service.session.SatelliteSession;
import com.phillippitts.groundstation.service.session.SatelliteSessionLifecycle;
import com.phillippitts.groundstation.service.session.SessionFixtures;
import com.phillippitts.groundstation.service.session.SessionRegistry;
import com.phillippitts.groundstation.testutil.RecordingTransport;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SatelliteWebSocketHandlerTest {

    private SatelliteSessionLifecycle lifecycle;
    private SatelliteWebSocketHandler handler;
    private WebSocketSession webSocket;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        lifecycle = mock(SatelliteSessionLifecycle.class);
        handler = new SatelliteWebSocketHandler(lifecycle);
        webSocket = mock(WebSocketSession.class);
        attributes = new HashMap<>();
        when(webSocket.getId()).thenReturn("ws-1");
        when(webSocket.getAttributes()).thenReturn(attributes);
        ThreadContext.clearAll();
    }

    @Test
    void acceptedConnectionIsAttachedToTheSocket() {
        SatelliteSession session = new SatelliteSession(new RecordingTransport("ws-1"));
        when(lifecycle.accept(any())).thenReturn(Optional.of(session));

        handler.afterConnectionEstablished(webSocket);

        assertThat(attributes).containsEntry(SatelliteWebSocketHandler.SESSION_ATTRIBUTE, session);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void rejectedConnectionLeavesNoAttribute() {
        when(lifecycle.accept(any())).thenReturn(Optional.empty());

        handler.afterConnectionEstablished(webSocket);

        assertThat(attributes).isEmpty();
    }

    @Test
    void firstTextFrameIsTheHandshake() {
        SatelliteSession session = new SatelliteSession(new RecordingTransport("ws-1"));
        attributes.put(SatelliteWebSocketHandler.SESSION_ATTRIBUTE, session);

        handler.handleTextMessage(webSocket, new TextMessage("{\"room\":\"kitchen\"}"));

        verify(lifecycle).configure(session, "{\"room\":\"kitchen\"}");
        verify(lifecycle, never()).onControlText(any(), anyString());
    }

    @Test
    void laterTextFramesAreControlSignals() {
        SatelliteSession session = configured();

        handler.handleTextMessage(webSocket, new TextMessage("START_COMMAND"));

        verify(lifecycle).onControlText(session, "START_COMMAND");
        verify(lifecycle, never()).configure(any(), anyString());
    }

    @Test
    void binaryBeforeHandshakeIsRejected() {
        SatelliteSession session = new SatelliteSession(new RecordingTransport("ws-1"));
        attributes.put(SatelliteWebSocketHandler.SESSION_ATTRIBUTE, session);

        handler.handleBinaryMessage(webSocket, new BinaryMessage(new byte[]{1, 2}));

        verify(lifecycle).rejectHandshake(any(), anyString());
        verify(lifecycle, never()).onAudio(any(), any());
    }

    @Test
    void binaryAfterHandshakeIsAudio() {
        SatelliteSession session = configured();

        handler.handleBinaryMessage(webSocket, new BinaryMessage(new byte[]{1, 2, 3, 4}));

        verify(lifecycle).onAudio(session, new byte[]{1, 2, 3, 4});
    }

    @Test
    void unexpectedFailureAbortsSession() {
        SatelliteSession session = configured();
        doThrow(new IllegalStateException("boom")).when(lifecycle).onControlText(session, "END_COMMAND");

        handler.handleTextMessage(webSocket, new TextMessage("END_COMMAND"));

        verify(lifecycle).abort(session, SatelliteCloseReason.INTERNAL_ERROR);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void closeAndTransportErrorTearDown() {
        SatelliteSession session = configured();

        handler.handleTransportError(webSocket, new IOException("reset"));
        handler.afterConnectionClosed(webSocket, CloseStatus.NORMAL);

        verify(lifecycle, times(2)).teardown(session);
    }

    @Test
    void framesWithoutSessionAreIgnored() {
        handler.handleTextMessage(webSocket, new TextMessage("START_COMMAND"));
        handler.handleBinaryMessage(webSocket, new BinaryMessage(new byte[]{1}));
        handler.afterConnectionClosed(webSocket, CloseStatus.NORMAL);

        verifyNoInteractions(lifecycle);
    }

    private SatelliteSession configured() {
        SatelliteSession session = SessionFixtures.configuredSession(
                new RecordingTransport("ws-1"), "kitchen", new SessionRegistry(new BrokerProperties()));
        attributes.put(SatelliteWebSocketHandler.SESSION_ATTRIBUTE, session);
        return session;
    }
}
