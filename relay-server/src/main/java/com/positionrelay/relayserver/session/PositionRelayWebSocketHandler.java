package com.positionrelay.relayserver.session;

import com.positionrelay.relayserver.config.RelayProperties;
import com.positionrelay.relayserver.identity.IdentityGenerator;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.relay.BroadcastDispatcher;
import com.positionrelay.relayserver.relay.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * WebSocket endpoint for player connections.
 *
 * Each accepted connection gets its own {@link ConnectionSession}, stored in
 * the WebSocket session attributes. Spring delivers inbound frames for one
 * connection sequentially, so a session's messages are handled in arrival order.
 *
 * Clients connect with {@code ws://host:port/game}. A reconnecting client may
 * pass {@code ?playerId=<id>} to resume its identity; any live connection
 * holding that identity is closed.
 */
@Component
public class PositionRelayWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(PositionRelayWebSocketHandler.class);

    static final String SESSION_ATTRIBUTE = "relay.session";
    static final String PLAYER_ID_PARAM = "playerId";
    private static final Pattern CLAIMABLE_ID = Pattern.compile("[0-9a-f]{2,64}");

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final MessageCodec codec;
    private final IdentityGenerator identityGenerator;
    private final RelayProperties properties;

    public PositionRelayWebSocketHandler(ConnectionRegistry registry,
            BroadcastDispatcher dispatcher,
            MessageCodec codec,
            IdentityGenerator identityGenerator,
            RelayProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.identityGenerator = identityGenerator;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(session);
        handle.applyReadTimeout(properties.readTimeout());
        ConnectionSession connection = new ConnectionSession(
                handle,
                registry,
                dispatcher,
                codec,
                identityGenerator,
                properties.writeTimeout());
        session.getAttributes().put(SESSION_ATTRIBUTE, connection);

        if (!connection.open(claimedPlayerId(session))) {
            log.info("Connection {} closed during initial sync", session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        ConnectionSession connection = connectionOf(session);
        if (connection == null) {
            log.warn("Received message on unregistered connection: {}", session.getId());
            return;
        }
        log.trace("Received message from {}: {}", connection.playerId(), message.getPayload());
        connection.onMessage(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        ConnectionSession connection = connectionOf(session);
        String playerId = connection != null ? connection.playerId() : null;
        log.warn("Transport error for player {} on connection {}: {}", playerId, session.getId(), exception.getMessage());

        if (connection != null) {
            connection.close();
        } else if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        ConnectionSession connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        if (status.equalsCode(CloseStatus.NORMAL) || status.equalsCode(CloseStatus.GOING_AWAY)) {
            log.debug("Connection of player {} closed: {}", connection.playerId(), status);
        } else {
            log.info("Connection of player {} closed unexpectedly: {}", connection.playerId(), status);
        }
        connection.close();
    }

    private ConnectionSession connectionOf(WebSocketSession session) {
        return (ConnectionSession) session.getAttributes().get(SESSION_ATTRIBUTE);
    }

    /**
     * Identity requested through the {@code playerId} query parameter, if
     * resuming is enabled and the value looks like a generated identifier.
     */
    String claimedPlayerId(WebSocketSession session) {
        if (!properties.allowIdentityResume()) {
            return null;
        }
        URI uri = session.getUri();
        if (uri == null) {
            return null;
        }
        String claimed = parseQueryString(uri.getRawQuery()).get(PLAYER_ID_PARAM);
        if (claimed == null) {
            return null;
        }
        if (!CLAIMABLE_ID.matcher(claimed).matches()) {
            log.warn("Ignoring invalid player ID claim on connection {}", session.getId());
            return null;
        }
        return claimed;
    }

    private Map<String, String> parseQueryString(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isBlank()) {
            return params;
        }
        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                params.put(URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8));
            }
        }
        return params;
    }
}
