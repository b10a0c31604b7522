package com.positionrelay.relayserver.session;

import com.positionrelay.relayserver.identity.IdentityGenerator;
import com.positionrelay.relayserver.registry.ConnectionHandle;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.registry.PlayerRecord;
import com.positionrelay.relayserver.relay.BroadcastDispatcher;
import com.positionrelay.relayserver.relay.MalformedMessageException;
import com.positionrelay.relayserver.relay.MessageCodec;
import com.positionrelay.relayserver.relay.MoveEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Server side of one client connection.
 *
 * {@link #open(String)} assigns the player identity, registers the
 * connection and pushes the initial state. {@link #onMessage(String)}
 * handles one inbound frame. {@link #close()} releases the connection and
 * its registry entry and may be called any number of times from any exit path.
 */
public class ConnectionSession {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    private final ConnectionHandle handle;
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final MessageCodec codec;
    private final IdentityGenerator identityGenerator;
    private final Duration writeTimeout;

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile String playerId;

    public ConnectionSession(ConnectionHandle handle,
            ConnectionRegistry registry,
            BroadcastDispatcher dispatcher,
            MessageCodec codec,
            IdentityGenerator identityGenerator,
            Duration writeTimeout) {
        this.handle = handle;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.identityGenerator = identityGenerator;
        this.writeTimeout = writeTimeout;
    }

    /**
     * Registers the connection and sends the initial sync: the player's own
     * record first, then one move per other connected player.
     *
     * @param claimedId identity the client asked to resume, or {@code null}
     *                  to have one generated
     * @return {@code false} if the session was closed before it became active,
     *         for example because the initial record could not be delivered
     */
    public boolean open(String claimedId) {
        playerId = claimedId != null ? claimedId : identityGenerator.generate();
        PlayerRecord record = PlayerRecord.spawn(playerId, registry.now());

        boolean delivered = true;
        // broadcasts to this handle wait until the initial sync is written
        synchronized (handle) {
            registry.add(handle, record);
            try {
                handle.send(codec.encodeInitialRecord(record), writeTimeout);
            } catch (IOException e) {
                log.warn("Error sending initial state to {}: {}", playerId, e.getMessage());
                delivered = false;
            }
            if (delivered && advance(SessionState.CONNECTING, SessionState.SYNCED)) {
                log.info("New player connected: {} on connection {}", playerId, handle.connectionId());
                sendExistingPlayers();
            }
        }

        if (!delivered) {
            close();
            return false;
        }
        return advance(SessionState.SYNCED, SessionState.ACTIVE);
    }

    private void sendExistingPlayers() {
        List<PlayerRecord> existing = registry.snapshot();
        log.debug("Sending {} existing players to new player {}", existing.size() - 1, playerId);
        for (PlayerRecord other : existing) {
            if (other.id().equals(playerId)) {
                continue;
            }
            try {
                handle.send(codec.encode(MoveEvent.move(other.id(), other.x(), other.y())), writeTimeout);
            } catch (IOException e) {
                log.warn("Error sending existing player {} to {}: {}", other.id(), playerId, e.getMessage());
            }
        }
    }

    /**
     * Handles one inbound frame. Malformed frames and unknown message types
     * are logged and dropped; the session stays active.
     *
     * @throws InterruptedException if interrupted while handing the move to the dispatcher
     */
    public void onMessage(String payload) throws InterruptedException {
        if (state != SessionState.ACTIVE) {
            log.debug("Dropping message for player {} in state {}", playerId, state);
            return;
        }

        MoveEvent event;
        try {
            event = codec.decode(payload);
        } catch (MalformedMessageException e) {
            log.warn("Error parsing message from {}: {}, raw message: {}", playerId, e.getMessage(), e.payload());
            return;
        }

        if (!event.isMove()) {
            log.debug("Ignoring message with unknown type {} from {}", event.type(), playerId);
            return;
        }

        // the sender can only ever move itself
        MoveEvent owned = event.attributedTo(playerId);
        registry.update(handle, owned.x(), owned.y());
        dispatcher.publish(owned);
    }

    public void close() {
        synchronized (this) {
            if (state == SessionState.CLOSED) {
                return;
            }
            state = SessionState.CLOSED;
        }
        handle.close();
        registry.delete(handle);
    }

    private synchronized boolean advance(SessionState from, SessionState to) {
        if (state != from) {
            return false;
        }
        state = to;
        return true;
    }

    public SessionState state() {
        return state;
    }

    public String playerId() {
        return playerId;
    }

    public ConnectionHandle handle() {
        return handle;
    }
}
