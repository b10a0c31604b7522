package com.positionrelay.relayserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Browser origins allowed to open player connections and read the JSON
 * status API, bound from {@code app.cors.allowed-origins}. Entries are
 * origin patterns, so {@code *} and {@code https://*.example.com} work.
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(@DefaultValue("*") List<String> allowedOrigins) {

    public String[] originPatterns() {
        return allowedOrigins.toArray(String[]::new);
    }
}
