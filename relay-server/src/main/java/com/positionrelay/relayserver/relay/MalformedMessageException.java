package com.positionrelay.relayserver.relay;

/**
 * Thrown when an inbound payload cannot be decoded into a {@link MoveEvent}.
 */
public class MalformedMessageException extends Exception {

    private final String payload;

    public MalformedMessageException(String message, String payload, Throwable cause) {
        super(message, cause);
        this.payload = payload;
    }

    public String payload() {
        return payload;
    }
}
