package com.positionrelay.relayserver.web;

import com.positionrelay.relayserver.config.RelayProperties;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.relay.BroadcastDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check: reports whether the broadcast dispatcher is running and how
 * many players are connected.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final RelayProperties properties;

    public HealthController(ConnectionRegistry registry, BroadcastDispatcher dispatcher, RelayProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean up = dispatcher.isRunning();
        Map<String, Object> body = Map.of(
                "status", up ? "UP" : "DOWN",
                "players", registry.size(),
                "endpoint", properties.endpoint());
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
