package com.positionrelay.relayserver.web;

import com.positionrelay.relayserver.registry.ConnectionRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Read-only HTML page listing connected players.
 */
@RestController
public class StatusController {
    private final ConnectionRegistry registry;

    public StatusController(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(value = "/status", produces = MediaType.TEXT_HTML_VALUE)
    public String status() {
        Instant now = registry.now();
        StringBuilder rows = new StringBuilder();
        int[] count = {0};

        registry.forEach((handle, record) -> {
            count[0]++;
            rows.append("<tr><td>").append(HtmlUtils.htmlEscape(record.id())).append("</td>")
                    .append(String.format(Locale.ROOT, "<td>(%.2f, %.2f)</td>", record.x(), record.y()))
                    .append("<td>").append(formatAge(Duration.between(record.lastSeen(), now))).append("</td></tr>");
            return true;
        });

        return "<html><body>"
                + "<h1>Game Server Status</h1>"
                + "<p>Connected players: " + count[0] + "</p>"
                + "<table border='1'><tr><th>ID</th><th>Position</th><th>Last Seen</th></tr>"
                + rows
                + "</table></body></html>";
    }

    static String formatAge(Duration age) {
        long millis = Math.max(0, age.toMillis());
        return String.format(Locale.ROOT, "%.1fs ago", millis / 1000.0);
    }
}
