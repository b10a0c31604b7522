package com.positionrelay.relayserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.positionrelay.relayserver.identity.IdentityGenerator;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.relay.BroadcastDispatcher;
import com.positionrelay.relayserver.relay.MessageCodec;
import com.positionrelay.relayserver.sweep.IdleSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Wires the relay core. The dispatcher and the sweeper are started here,
 * before the web server begins accepting connections.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {
    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    private final RelayProperties properties;

    public RelayConfig(RelayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public IdentityGenerator identityGenerator() {
        return new IdentityGenerator(properties.idBytes());
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean(destroyMethod = "shutdown")
    public BroadcastDispatcher broadcastDispatcher(ConnectionRegistry registry, MessageCodec codec) {
        BroadcastDispatcher dispatcher = new BroadcastDispatcher(
                registry,
                codec,
                properties.broadcastWriteTimeout(),
                properties.dispatchQueueCapacity());
        dispatcher.start();
        return dispatcher;
    }

    @Bean(destroyMethod = "shutdown")
    public IdleSweeper idleSweeper(ConnectionRegistry registry) {
        IdleSweeper sweeper = new IdleSweeper(registry, properties.sweepInterval(), properties.staleTimeout());
        sweeper.start();
        return sweeper;
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        log.info("Game server listening on port {}, players connect at ws://localhost:{}{}",
                port, port, properties.endpoint());
        log.info("View status at http://localhost:{}/status", port);
    }
}
