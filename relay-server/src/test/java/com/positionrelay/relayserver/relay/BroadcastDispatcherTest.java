package com.positionrelay.relayserver.relay;

import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.registry.PlayerRecord;
import com.positionrelay.relayserver.registry.RecordingConnectionHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BroadcastDispatcher.
 * Tests fan-out, sender exclusion, failure isolation and FIFO delivery.
 */
class BroadcastDispatcherTest {

    private final MessageCodec codec = new MessageCodec();
    private ConnectionRegistry registry;
    private BroadcastDispatcher dispatcher;
    private RecordingConnectionHandle alice;
    private RecordingConnectionHandle bob;
    private RecordingConnectionHandle carol;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        dispatcher = new BroadcastDispatcher(registry, codec, Duration.ofSeconds(5), 0);
        alice = register("alice-conn", "aa");
        bob = register("bob-conn", "bb");
        carol = register("carol-conn", "cc");
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private RecordingConnectionHandle register(String connectionId, String playerId) {
        RecordingConnectionHandle handle = new RecordingConnectionHandle(connectionId);
        registry.add(handle, PlayerRecord.spawn(playerId, Instant.now()));
        return handle;
    }

    @Test
    void dispatch_WritesToEveryPeerButTheSender() throws Exception {
        int sent = dispatcher.dispatch(MoveEvent.move("aa", 1, 2));

        assertEquals(2, sent);
        assertTrue(alice.sent().isEmpty());
        assertEquals(1, bob.sent().size());
        assertEquals(1, carol.sent().size());
        assertEquals(MoveEvent.move("aa", 1, 2), codec.decode(bob.sent().get(0)));
    }

    @Test
    void dispatch_OnePeerFails_OthersStillReceive() {
        bob.failSends();

        int sent = dispatcher.dispatch(MoveEvent.move("aa", 1, 2));

        assertEquals(1, sent);
        assertEquals(1, carol.sent().size());
    }

    @Test
    void dispatch_FailedPeer_StaysRegistered() {
        bob.failSends();

        dispatcher.dispatch(MoveEvent.move("aa", 1, 2));

        assertTrue(registry.connectionOf("bb").isPresent());
        assertEquals(3, registry.size());
    }

    @Test
    void publish_NotStarted_IsRejected() {
        assertThrows(IllegalStateException.class, () -> dispatcher.publish(MoveEvent.move("aa", 1, 2)));
    }

    @Test
    void publish_EventsFromOneSender_ArriveInOrder() throws Exception {
        dispatcher.start();

        for (int i = 0; i < 20; i++) {
            dispatcher.publish(MoveEvent.move("aa", i, i));
        }

        awaitFrames(bob, 20);
        List<String> frames = bob.sent();
        for (int i = 0; i < 20; i++) {
            assertEquals((double) i, codec.decode(frames.get(i)).x());
        }
        assertTrue(alice.sent().isEmpty());
    }

    @Test
    void publish_WorkerBusy_PublisherBlocksUntilHandOff() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch writing = new CountDownLatch(1);
        RecordingConnectionHandle slow = new RecordingConnectionHandle("slow-conn") {
            @Override
            public void send(String payload, Duration deadline) throws IOException {
                writing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.send(payload, deadline);
            }
        };
        registry.add(slow, PlayerRecord.spawn("dd", Instant.now()));
        dispatcher.start();
        ExecutorService publisher = Executors.newSingleThreadExecutor();
        try {
            dispatcher.publish(MoveEvent.move("aa", 1, 1));
            assertTrue(writing.await(2, TimeUnit.SECONDS));

            Future<?> second = publisher.submit(() -> {
                dispatcher.publish(MoveEvent.move("aa", 2, 2));
                return null;
            });
            Thread.sleep(300);
            assertFalse(second.isDone());

            release.countDown();
            second.get(5, TimeUnit.SECONDS);
            awaitFrames(slow, 2);
        } finally {
            release.countDown();
            publisher.shutdownNow();
        }
    }

    @Test
    void shutdown_StopsAcceptingEvents() {
        dispatcher.start();
        assertTrue(dispatcher.isRunning());

        dispatcher.shutdown();

        assertFalse(dispatcher.isRunning());
        assertThrows(IllegalStateException.class, () -> dispatcher.publish(MoveEvent.move("aa", 1, 2)));
    }

    private static void awaitFrames(RecordingConnectionHandle handle, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (handle.sent().size() < count) {
            if (System.nanoTime() > deadline) {
                fail("expected " + count + " frames on " + handle.connectionId() + " but got " + handle.sent().size());
            }
            Thread.sleep(10);
        }
    }
}
