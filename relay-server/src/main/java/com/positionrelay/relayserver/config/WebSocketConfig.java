package com.positionrelay.relayserver.config;

import com.positionrelay.relayserver.session.PositionRelayWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for player connections.
 *
 * Clients connect with ws://host:port/game (path from {@code relay.endpoint}).
 * The per-connection read deadline is set on each session by the handler
 * (only inbound frames reset it). The container-wide idle timeout below uses
 * the same value and is also reset by outbound frames, so it only bounds
 * connections that are silent in both directions.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final int MAX_TEXT_MESSAGE_BYTES = 8192;

    private final PositionRelayWebSocketHandler positionRelayWebSocketHandler;
    private final RelayProperties relayProperties;
    private final CorsProperties corsProperties;

    public WebSocketConfig(PositionRelayWebSocketHandler positionRelayWebSocketHandler,
            RelayProperties relayProperties,
            CorsProperties corsProperties) {
        this.positionRelayWebSocketHandler = positionRelayWebSocketHandler;
        this.relayProperties = relayProperties;
        this.corsProperties = corsProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(positionRelayWebSocketHandler, relayProperties.endpoint())
                .setAllowedOriginPatterns(corsProperties.originPatterns());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxSessionIdleTimeout(relayProperties.readTimeout().toMillis());
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        container.setAsyncSendTimeout(relayProperties.writeTimeout().toMillis());
        return container;
    }
}
