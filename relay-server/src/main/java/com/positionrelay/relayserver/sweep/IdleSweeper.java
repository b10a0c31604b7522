package com.positionrelay.relayserver.sweep;

import com.positionrelay.relayserver.registry.ConnectionRegistry;
import com.positionrelay.relayserver.registry.PlayerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts players that have not sent a valid message within the
 * stale timeout. Closing the evicted connection also ends its session.
 */
public class IdleSweeper {
    private static final Logger log = LoggerFactory.getLogger(IdleSweeper.class);

    private final ConnectionRegistry registry;
    private final Duration interval;
    private final Duration staleTimeout;
    private final ScheduledExecutorService sweepExecutor = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "idle-sweeper");
        t.setDaemon(true);
        return t;
    });

    public IdleSweeper(ConnectionRegistry registry, Duration interval, Duration staleTimeout) {
        if (staleTimeout.compareTo(interval) <= 0) {
            throw new IllegalArgumentException("Stale timeout " + staleTimeout
                    + " must be longer than the sweep interval " + interval);
        }
        this.registry = registry;
        this.interval = interval;
        this.staleTimeout = staleTimeout;
    }

    public void start() {
        sweepExecutor.scheduleAtFixedRate(
                this::sweep,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Idle sweeper started: every {} ms, stale after {} ms", interval.toMillis(), staleTimeout.toMillis());
    }

    /**
     * Runs one sweep. Failures are logged so later ticks still run.
     *
     * @return number of evicted players
     */
    public int sweep() {
        try {
            List<PlayerRecord> evicted = registry.sweepStale(staleTimeout);
            if (!evicted.isEmpty()) {
                log.info("Swept {} inactive players, {} remaining", evicted.size(), registry.size());
            }
            return evicted.size();
        } catch (RuntimeException e) {
            log.error("Idle sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    public void shutdown() {
        sweepExecutor.shutdownNow();
        log.info("Idle sweeper shut down");
    }
}
