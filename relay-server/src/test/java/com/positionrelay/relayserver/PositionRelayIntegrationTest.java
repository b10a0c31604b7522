package com.positionrelay.relayserver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests over real WebSocket connections.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PositionRelayIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private WebApplicationContext context;

    private final ObjectMapper mapper = new ObjectMapper();
    private final StandardWebSocketClient client = new StandardWebSocketClient();
    private final List<WebSocketSession> opened = new ArrayList<>();

    @AfterEach
    void closeClients() throws Exception {
        for (WebSocketSession session : opened) {
            if (session.isOpen()) {
                session.close();
            }
        }
        awaitCondition(() -> registry.size() == 0);
    }

    @Test
    void twoPlayers_EachSeeOnlyTheOthersMove() throws Exception {
        Player first = connect("");
        String firstId = first.next().get("id").asText();

        Player second = connect("");
        String secondId = second.next().get("id").asText();
        JsonNode existing = second.next();
        assertEquals("move", existing.get("type").asText());
        assertEquals(firstId, existing.get("playerId").asText());

        first.send("{\"type\":\"move\",\"playerId\":\"" + firstId + "\",\"x\":1,\"y\":2}");
        JsonNode seenBySecond = second.next();
        assertEquals(firstId, seenBySecond.get("playerId").asText());
        assertEquals(1.0, seenBySecond.get("x").asDouble());
        assertEquals(2.0, seenBySecond.get("y").asDouble());

        second.send("{\"type\":\"move\",\"playerId\":\"" + secondId + "\",\"x\":3,\"y\":4}");
        JsonNode seenByFirst = first.next();
        assertEquals(secondId, seenByFirst.get("playerId").asText());
        assertEquals(3.0, seenByFirst.get("x").asDouble());
        assertEquals(4.0, seenByFirst.get("y").asDouble());

        assertNull(first.poll(300));
        assertNull(second.poll(300));
    }

    @Test
    void spoofedMove_IsRelayedUnderSendersOwnId() throws Exception {
        Player mover = connect("");
        String moverId = mover.next().get("id").asText();
        Player watcher = connect("");
        String watcherId = watcher.next().get("id").asText();
        watcher.next();

        mover.send("{\"type\":\"move\",\"playerId\":\"" + watcherId + "\",\"x\":5,\"y\":6}");

        JsonNode relayed = watcher.next();
        assertEquals(moverId, relayed.get("playerId").asText());
        assertNull(mover.poll(300));
    }

    @Test
    void malformedMessage_DoesNotCloseConnection() throws Exception {
        Player sender = connect("");
        sender.next();
        Player watcher = connect("");
        watcher.next();
        watcher.next();

        sender.send("this is not json");
        sender.send("{\"type\":\"wave\"}");
        sender.send("{\"type\":\"move\",\"x\":7,\"y\":8}");

        JsonNode relayed = watcher.next();
        assertEquals(7.0, relayed.get("x").asDouble());
        assertTrue(sender.session.isOpen());
    }

    @Test
    void reconnectWithSameId_ClosesOldConnection() throws Exception {
        Player original = connect("");
        String id = original.next().get("id").asText();

        Player resumed = connect("?playerId=" + id);
        assertEquals(id, resumed.next().get("id").asText());

        assertNotNull(original.closed.poll(5, TimeUnit.SECONDS));
        awaitCondition(() -> registry.size() == 1);
        assertTrue(registry.connectionOf(id).isPresent());
    }

    @Test
    void disconnect_RemovesPlayerFromRegistryAndStatusPage() throws Exception {
        Player player = connect("");
        String id = player.next().get("id").asText();

        ResponseEntity<String> page = restTemplate.getForEntity("/status", String.class);
        assertTrue(page.getBody().contains(id));

        player.session.close(CloseStatus.NORMAL);
        awaitCondition(() -> registry.connectionOf(id).isEmpty());

        ResponseEntity<String> after = restTemplate.getForEntity("/status", String.class);
        assertFalse(after.getBody().contains(id));
    }

    @Test
    void playerApi_CrossOriginPreflight_IsAllowed() throws Exception {
        MockMvc mockMvc = MockMvcBuilders.webAppContextSetup(context).build();

        mockMvc.perform(options("/api/players")
                        .header("Origin", "http://dashboard.example.com")
                        .header("Access-Control-Request-Method", "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://dashboard.example.com"));
    }

    private Player connect(String query) throws Exception {
        Player player = new Player();
        player.session = client.execute(player, "ws://localhost:" + port + "/game" + query)
                .get(5, TimeUnit.SECONDS);
        opened.add(player.session);
        return player;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private class Player extends TextWebSocketHandler {
        private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        private final BlockingQueue<CloseStatus> closed = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            inbox.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.add(status);
        }

        JsonNode next() throws Exception {
            String payload = inbox.poll(5, TimeUnit.SECONDS);
            assertNotNull(payload, "no message within 5s");
            return mapper.readTree(payload);
        }

        String poll(long millis) throws InterruptedException {
            return inbox.poll(millis, TimeUnit.MILLISECONDS);
        }

        void send(String payload) throws Exception {
            session.sendMessage(new TextMessage(payload));
        }
    }
}
