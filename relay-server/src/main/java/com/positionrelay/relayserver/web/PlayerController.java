package com.positionrelay.relayserver.web;

import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.web.dto.PlayerStatusDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerController {
    private final ConnectionRegistry registry;

    public PlayerController(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Connected players ordered by ID.
     */
    @GetMapping
    public List<PlayerStatusDto> players() {
        Instant now = registry.now();
        return registry.snapshot().stream()
                .map(record -> PlayerStatusDto.fromRecord(record, now))
                .sorted(Comparator.comparing(PlayerStatusDto::id))
                .toList();
    }
}
