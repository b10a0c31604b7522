package com.positionrelay.relayserver.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin access to the read-only player API, for dashboards served
 * from another origin than the relay.
 */
@Configuration
@EnableConfigurationProperties(CorsProperties.class)
public class CorsConfig implements WebMvcConfigurer {

    static final String PLAYER_API_PATTERN = "/api/**";

    private final CorsProperties corsProperties;

    public CorsConfig(CorsProperties corsProperties) {
        this.corsProperties = corsProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(PLAYER_API_PATTERN)
                .allowedOriginPatterns(corsProperties.originPatterns())
                .allowedMethods("GET", "OPTIONS");
    }
}
