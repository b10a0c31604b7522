package com.positionrelay.relayserver.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Produces session identifiers for newly connected players.
 *
 * Identifiers are random bytes from a {@link SecureRandom}, hex encoded.
 * If the entropy source fails, a timestamp-derived identifier is returned
 * instead so the connection can still be accepted.
 */
public class IdentityGenerator {
    private static final Logger log = LoggerFactory.getLogger(IdentityGenerator.class);

    private final SecureRandom random;
    private final Clock clock;
    private final int idBytes;

    public IdentityGenerator(int idBytes) {
        this(new SecureRandom(), Clock.systemUTC(), idBytes);
    }

    public IdentityGenerator(SecureRandom random, Clock clock, int idBytes) {
        if (idBytes <= 0) {
            throw new IllegalArgumentException("idBytes must be positive: " + idBytes);
        }
        this.random = random;
        this.clock = clock;
        this.idBytes = idBytes;
    }

    /**
     * Generates a new identifier.
     *
     * @return hex string of {@code 2 * idBytes} characters, or a longer
     *         timestamp-derived hex string when the random source fails
     */
    public String generate() {
        byte[] bytes = new byte[idBytes];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            log.error("Error generating secure ID, falling back to timestamp: {}", e.getMessage());
            return fallbackId();
        }
        return HexFormat.of().formatHex(bytes);
    }

    private String fallbackId() {
        String timestamp = clock.instant().toString();
        return HexFormat.of().formatHex(timestamp.getBytes(StandardCharsets.UTF_8));
    }
}
