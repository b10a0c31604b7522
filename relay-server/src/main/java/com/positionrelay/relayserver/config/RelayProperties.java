package com.positionrelay.relayserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables of the relay, bound from {@code relay.*}.
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        @NotBlank @DefaultValue("/game") String endpoint,
        @NotNull @DefaultValue("120s") Duration readTimeout,
        @NotNull @DefaultValue("10s") Duration writeTimeout,
        @NotNull @DefaultValue("5s") Duration broadcastWriteTimeout,
        @NotNull @DefaultValue("10s") Duration sweepInterval,
        @NotNull @DefaultValue("30s") Duration staleTimeout,
        @PositiveOrZero @DefaultValue("0") int dispatchQueueCapacity,
        @Min(1) @Max(32) @DefaultValue("4") int idBytes,
        @DefaultValue("true") boolean allowIdentityResume
) {
}
