package com.positionrelay.relayserver.session;

/**
 * Lifecycle of one client connection: CONNECTING -> SYNCED -> ACTIVE -> CLOSED.
 * A session may jump to CLOSED from any state.
 */
public enum SessionState {
    CONNECTING,
    SYNCED,
    ACTIVE,
    CLOSED
}
