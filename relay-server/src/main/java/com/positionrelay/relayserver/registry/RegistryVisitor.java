package com.positionrelay.relayserver.registry;

/**
 * Callback for {@link ConnectionRegistry#forEach(RegistryVisitor)}.
 * Runs while the registry lock is held and must not call back into the registry.
 */
@FunctionalInterface
public interface RegistryVisitor {

    /**
     * @return {@code true} to continue with the next entry, {@code false} to stop
     */
    boolean visit(ConnectionHandle handle, PlayerRecord record);
}
