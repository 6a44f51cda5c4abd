package com.phillippitts.groundstation.config;

import com.phillippitts.groundstation.presentation.websocket.SatelliteWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the satellite WebSocket endpoint and sizes the container for raw audio frames.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    /** Endpoint satellites connect to. */
    public static final String SATELLITE_PATH = "/satellite";

    static final int MAX_MESSAGE_BYTES = 1024 * 1024;

    private final SatelliteWebSocketHandler satelliteHandler;

    public WebSocketConfig(SatelliteWebSocketHandler satelliteHandler) {
        this.satelliteHandler = satelliteHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(satelliteHandler, SATELLITE_PATH)
                .setAllowedOrigins("*");
    }

    /**
     * Raises the container's frame size limits so a full audio chunk or synthesized reply fits
     * in one message.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(MAX_MESSAGE_BYTES);
        container.setAsyncSendTimeout(10_000L);
        return container;
    }
}
