package com.cardroll.pity;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory pity store for testing and local development.
 *
 * Can simulate an unavailable or slow backend through {@link #setAvailable(boolean)}
 * and {@link #setLatency(Duration)}. Not registered as a bean.
 */
@Slf4j
public class InMemoryPityStore implements PityStore {

    private final Map<String, Map<String, PityState>> states = new ConcurrentHashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    private volatile boolean available = true;
    private volatile Duration latency = Duration.ZERO;

    @Override
    public Map<String, PityState> load(String playerId) {
        simulateBackend("load");
        return Map.copyOf(states.getOrDefault(playerId, Map.of()));
    }

    @Override
    public void save(String playerId, Map<String, PityState> playerStates) {
        simulateBackend("save");
        states.put(playerId, Map.copyOf(playerStates));
        saveCount.incrementAndGet();
        log.debug("Saved pity state for player {}: {}", playerId, playerStates);
    }

    public Map<String, PityState> stored(String playerId) {
        return states.getOrDefault(playerId, Map.of());
    }

    public int getSaveCount() {
        return saveCount.get();
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    private void simulateBackend(String operation) {
        if (!latency.isZero()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted during " + operation, e);
            }
        }
        if (!available) {
            throw new IllegalStateException("Pity store unavailable during " + operation);
        }
    }
}
