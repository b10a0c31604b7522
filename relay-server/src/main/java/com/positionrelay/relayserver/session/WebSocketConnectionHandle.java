package com.positionrelay.relayserver.session;

import com.positionrelay.relayserver.registry.ConnectionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link ConnectionHandle} over a Spring {@link WebSocketSession}.
 *
 * Sends are serialized on this handle's monitor so frames from the dispatcher
 * and from the session's own initial sync never interleave. The per-send
 * deadline is handed to the servlet container as its blocking-send timeout,
 * and the read deadline as its read-only idle timeout.
 */
public class WebSocketConnectionHandle implements ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionHandle.class);

    static final String BLOCKING_SEND_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";
    static final String READ_IDLE_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.READ_IDLE_TIMEOUT_MS";

    private final WebSocketSession session;

    public WebSocketConnectionHandle(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String connectionId() {
        return session.getId();
    }

    @Override
    public void send(String payload, Duration deadline) throws IOException {
        synchronized (this) {
            if (!session.isOpen()) {
                throw new IOException("Connection " + session.getId() + " is closed");
            }
            applySendTimeout(deadline);
            try {
                session.sendMessage(new TextMessage(payload));
            } catch (IllegalStateException e) {
                throw new IOException("Send failed on connection " + session.getId() + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Error closing connection {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Closes the connection once no frame has been received for {@code timeout}.
     * Outbound frames do not reset this deadline.
     */
    public void applyReadTimeout(Duration timeout) {
        putContainerProperty(READ_IDLE_TIMEOUT_PROPERTY, timeout.toMillis());
    }

    private void applySendTimeout(Duration deadline) {
        putContainerProperty(BLOCKING_SEND_TIMEOUT_PROPERTY, deadline.toMillis());
    }

    private void putContainerProperty(String key, long millis) {
        if (session instanceof NativeWebSocketSession nativeSession) {
            jakarta.websocket.Session container = nativeSession.getNativeSession(jakarta.websocket.Session.class);
            if (container != null) {
                container.getUserProperties().put(key, millis);
            }
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnectionHandle[" + session.getId() + "]";
    }
}
