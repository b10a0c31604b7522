package com.positionrelay.relayserver.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of truth for connected players.
 *
 * Keeps two maps, connection -> player record and player ID -> connection,
 * guarded by the registry's monitor so they always agree with each other.
 * Connections evicted by {@link #add} or {@link #sweepStale} are closed only
 * after the monitor is released, so a slow peer never stalls other callers.
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<ConnectionHandle, PlayerRecord> players = new IdentityHashMap<>();
    private final Map<String, ConnectionHandle> connections = new HashMap<>();
    private final Clock clock;

    public ConnectionRegistry() {
        this(Clock.systemUTC());
    }

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Registers a connection. If another connection already holds
     * {@code record.id()}, that connection is removed and closed first.
     */
    public void add(ConnectionHandle handle, PlayerRecord record) {
        ConnectionHandle displaced;
        int total;
        synchronized (this) {
            displaced = connections.get(record.id());
            if (displaced != null) {
                players.remove(displaced);
                connections.remove(record.id());
            }
            PlayerRecord previous = players.put(handle, record);
            if (previous != null && !previous.id().equals(record.id())) {
                // the same connection re-registered under a new ID
                connections.remove(previous.id());
            }
            connections.put(record.id(), handle);
            total = players.size();
        }

        if (displaced != null && displaced != handle) {
            log.info("Player {} already exists, closing old connection {}", record.id(), displaced.connectionId());
            displaced.close();
        }
        log.info("Added player {}. Total players: {}", record.id(), total);
    }

    /**
     * Overwrites the position of a registered connection and refreshes its
     * last-seen time. Unknown connections are ignored.
     *
     * @return {@code true} if the connection was registered
     */
    public boolean update(ConnectionHandle handle, double x, double y) {
        synchronized (this) {
            PlayerRecord current = players.get(handle);
            if (current == null) {
                log.warn("Tried to update non-existent player on connection {}", handle.connectionId());
                return false;
            }
            PlayerRecord moved = current.moveTo(x, y, clock.instant());
            players.put(handle, moved);
            if (x != 0 || y != 0) {
                log.debug("Updated player {} position to ({}, {})", moved.id(), x, y);
            }
            return true;
        }
    }

    /**
     * Removes a connection and its player. Calling it again for the same
     * connection has no effect.
     *
     * @return the removed record, if the connection was registered
     */
    public Optional<PlayerRecord> delete(ConnectionHandle handle) {
        PlayerRecord removed;
        int total;
        synchronized (this) {
            removed = players.remove(handle);
            if (removed != null) {
                connections.remove(removed.id(), handle);
            }
            total = players.size();
        }

        if (removed == null) {
            log.debug("Tried to delete unknown player connection {}", handle.connectionId());
            return Optional.empty();
        }
        log.info("Player {} disconnected, total players: {}", removed.id(), total);
        return Optional.of(removed);
    }

    /**
     * Point-in-time copy of all player records.
     */
    public synchronized List<PlayerRecord> snapshot() {
        return new ArrayList<>(players.values());
    }

    /**
     * Visits every entry while holding the registry monitor, stopping early
     * when the visitor returns {@code false}.
     */
    public synchronized void forEach(RegistryVisitor visitor) {
        for (Map.Entry<ConnectionHandle, PlayerRecord> entry : players.entrySet()) {
            if (!visitor.visit(entry.getKey(), entry.getValue())) {
                break;
            }
        }
    }

    /**
     * Removes and closes every connection whose player has not been seen for
     * longer than {@code timeout}.
     *
     * @return the evicted records
     */
    public List<PlayerRecord> sweepStale(Duration timeout) {
        List<ConnectionHandle> evicted = new ArrayList<>();
        List<PlayerRecord> evictedRecords = new ArrayList<>();
        synchronized (this) {
            Instant now = clock.instant();
            Iterator<Map.Entry<ConnectionHandle, PlayerRecord>> it = players.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<ConnectionHandle, PlayerRecord> entry = it.next();
                // IdentityHashMap entries are invalid once removed
                ConnectionHandle handle = entry.getKey();
                PlayerRecord record = entry.getValue();
                if (Duration.between(record.lastSeen(), now).compareTo(timeout) > 0) {
                    it.remove();
                    connections.remove(record.id(), handle);
                    evicted.add(handle);
                    evictedRecords.add(record);
                }
            }
        }

        for (int i = 0; i < evicted.size(); i++) {
            log.info("Removing inactive player {}", evictedRecords.get(i).id());
            evicted.get(i).close();
        }
        return evictedRecords;
    }

    public synchronized Optional<ConnectionHandle> connectionOf(String playerId) {
        return Optional.ofNullable(connections.get(playerId));
    }

    public synchronized Optional<PlayerRecord> recordOf(ConnectionHandle handle) {
        return Optional.ofNullable(players.get(handle));
    }

    public synchronized int size() {
        return players.size();
    }

    /**
     * Checks that both maps describe the same set of connections.
     */
    synchronized boolean isConsistent() {
        if (players.size() != connections.size()) {
            return false;
        }
        for (Map.Entry<ConnectionHandle, PlayerRecord> entry : players.entrySet()) {
            if (connections.get(entry.getValue().id()) != entry.getKey()) {
                return false;
            }
        }
        return true;
    }
}
