package com.positionrelay.relayserver.web.dto;

import com.positionrelay.relayserver.registry.PlayerRecord;

import java.time.Duration;
import java.time.Instant;

public record PlayerStatusDto(String id, double x, double y, Instant lastSeen, long idleMillis) {
    public static PlayerStatusDto fromRecord(PlayerRecord record, Instant now) {
        return new PlayerStatusDto(
                record.id(),
                record.x(),
                record.y(),
                record.lastSeen(),
                Math.max(0, Duration.between(record.lastSeen(), now).toMillis())
        );
    }
}
