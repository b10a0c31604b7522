package com.positionrelay.relayserver.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A single position update, either received from a client or queued for fan-out.
 */
public record MoveEvent(String type, String playerId, double x, double y) {

    public static final String TYPE_MOVE = "move";

    public static MoveEvent move(String playerId, double x, double y) {
        return new MoveEvent(TYPE_MOVE, playerId, x, y);
    }

    @JsonIgnore
    public boolean isMove() {
        return TYPE_MOVE.equals(type);
    }

    /**
     * Copy of this event attributed to {@code ownerId}, whatever player the sender claimed.
     */
    public MoveEvent attributedTo(String ownerId) {
        return new MoveEvent(type, ownerId, x, y);
    }
}
