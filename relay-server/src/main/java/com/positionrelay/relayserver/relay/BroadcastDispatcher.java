package com.positionrelay.relayserver.relay;

import com.positionrelay.relayserver.registry.ConnectionHandle;
import com.positionrelay.relayserver.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Relays move events to every connected player except the one who moved.
 *
 * Publishers hand events to a single worker thread, which fans them out one
 * at a time in FIFO order. With a queue capacity of zero the hand-off is
 * synchronous: {@link #publish} blocks until the worker takes the event.
 *
 * A failed write to one peer is logged and skipped. The dispatcher never
 * removes registry entries itself; dead peers are cleaned up by their own
 * session or by the idle sweeper.
 */
public class BroadcastDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);
    private static final long OFFER_POLL_MS = 100;

    private final ConnectionRegistry registry;
    private final MessageCodec codec;
    private final Duration writeTimeout;
    private final BlockingQueue<MoveEvent> queue;
    private final Thread worker;
    private volatile boolean running;

    public BroadcastDispatcher(ConnectionRegistry registry, MessageCodec codec,
            Duration writeTimeout, int queueCapacity) {
        this.registry = registry;
        this.codec = codec;
        this.writeTimeout = writeTimeout;
        this.queue = queueCapacity == 0
                ? new SynchronousQueue<>(true)
                : new LinkedBlockingQueue<>(queueCapacity);
        this.worker = new Thread(this::runLoop, "broadcast-dispatcher");
        this.worker.setDaemon(true);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker.start();
        log.info("Broadcast dispatcher started (write timeout {} ms)", writeTimeout.toMillis());
    }

    /**
     * Queues an event for fan-out, blocking while the queue is full.
     *
     * @throws InterruptedException  if the caller is interrupted while waiting
     * @throws IllegalStateException if the dispatcher is not running
     */
    public void publish(MoveEvent event) throws InterruptedException {
        while (true) {
            if (!running) {
                throw new IllegalStateException("Broadcast dispatcher is not running");
            }
            if (queue.offer(event, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public void shutdown() {
        running = false;
        worker.interrupt();
        log.info("Broadcast dispatcher shut down");
    }

    private void runLoop() {
        while (running) {
            MoveEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                dispatch(event);
            } catch (RuntimeException e) {
                log.error("Unexpected error broadcasting move of player {}: {}", event.playerId(), e.getMessage(), e);
            }
        }
        log.debug("Broadcast dispatcher worker exiting");
    }

    /**
     * Writes one event to every registered connection except the mover's.
     * Writes happen outside the registry monitor.
     *
     * @return number of peers the event was written to
     */
    int dispatch(MoveEvent event) {
        String payload = codec.encode(event);

        List<Peer> peers = new ArrayList<>();
        registry.forEach((handle, record) -> {
            if (!record.id().equals(event.playerId())) {
                peers.add(new Peer(handle, record.id()));
            }
            return true;
        });

        int sentCount = 0;
        for (Peer peer : peers) {
            log.trace("Broadcasting movement of player {} to player {}: ({}, {})",
                    event.playerId(), peer.playerId(), event.x(), event.y());
            try {
                peer.handle().send(payload, writeTimeout);
                sentCount++;
            } catch (IOException e) {
                log.warn("Error broadcasting to {}: {}", peer.playerId(), e.getMessage());
            }
        }

        log.debug("Broadcast complete: sent to {} out of {} players", sentCount, peers.size());
        return sentCount;
    }

    private record Peer(ConnectionHandle handle, String playerId) {
    }
}
