package com.positionrelay.relayserver.registry;

import java.time.Instant;

/**
 * Server-side position and liveness marker of one connected player.
 * Immutable; the registry replaces the record on every update.
 */
public record PlayerRecord(String id, double x, double y, Instant lastSeen) {

    public static PlayerRecord spawn(String id, Instant now) {
        return new PlayerRecord(id, 0, 0, now);
    }

    public PlayerRecord moveTo(double newX, double newY, Instant seen) {
        Instant refreshed = seen.isAfter(lastSeen) ? seen : lastSeen;
        return new PlayerRecord(id, newX, newY, refreshed);
    }
}
