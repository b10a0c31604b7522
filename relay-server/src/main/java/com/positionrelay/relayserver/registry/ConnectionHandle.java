package com.positionrelay.relayserver.registry;

import java.io.IOException;
import java.time.Duration;

/**
 * One live bidirectional client connection.
 *
 * The registry keys its maps on handles, so implementations must keep the
 * identity semantics of {@link Object#equals(Object)}: two handles are the
 * same connection only if they are the same object.
 *
 * Implementations serialize {@link #send} on the handle's own monitor. A
 * caller holding {@code synchronized (handle)} keeps every other writer out
 * until it releases it.
 */
public interface ConnectionHandle {

    /**
     * Transport-assigned token, used for logging only.
     */
    String connectionId();

    /**
     * Writes one text frame, failing if it cannot complete within {@code deadline}.
     */
    void send(String payload, Duration deadline) throws IOException;

    /**
     * Closes the connection. Closing an already closed handle has no effect.
     */
    void close();

    boolean isOpen();
}
