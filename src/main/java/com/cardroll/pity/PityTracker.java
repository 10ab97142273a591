package com.cardroll.pity;

import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.TransientPersistenceException;
import com.cardroll.pack.PackType;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-player pity state with one lock per player.
 *
 * Counters are cached in process after the first load of a player. Every read and write of a
 * player's counters happens while holding that player's lock; players never share a lock.
 * Store calls run on {@code storeExecutor} and are bounded by {@code storeTimeout}.
 *
 * Saves of one player are chained: a save starts only after the previous save of that player
 * has finished, even when the caller stopped waiting for it. A late write therefore never
 * lands after a newer one. Idle players are dropped from the cache by {@link #evictIdle(Duration)}.
 */
@Slf4j
public class PityTracker {

    private final PityStore store;
    private final ExecutorService storeExecutor;
    private final Duration storeTimeout;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    // Inner maps are only touched while holding the owning player's lock.
    private final Map<String, Map<String, PityState>> cache = new ConcurrentHashMap<>();

    // player id -> failed save attempts
    private final Map<String, Integer> pendingSaves = new ConcurrentHashMap<>();

    // player id -> last submitted save, possibly still running
    private final Map<String, CompletableFuture<Void>> saveChains = new ConcurrentHashMap<>();

    private final Map<String, Instant> lastAccess = new ConcurrentHashMap<>();

    public PityTracker(PityStore store, ExecutorService storeExecutor, Duration storeTimeout) {
        this(store, storeExecutor, storeTimeout, Clock.systemUTC());
    }

    public PityTracker(PityStore store, ExecutorService storeExecutor, Duration storeTimeout, Clock clock) {
        this.store = store;
        this.storeExecutor = storeExecutor;
        this.storeTimeout = storeTimeout;
        this.clock = clock;
    }

    /**
     * Run {@code action} while holding the player's lock.
     *
     * If the action throws, the player's counters are restored to their values from before
     * the action, so a failed batch leaves no partial pity updates behind.
     */
    public <T> T runExclusive(String playerId, Supplier<T> action) {
        ReentrantLock lock = acquire(playerId);
        try {
            Map<String, PityState> states = statesFor(playerId);
            Map<String, PityState> snapshot = new HashMap<>(states);
            try {
                return action.get();
            } catch (RuntimeException e) {
                states.clear();
                states.putAll(snapshot);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when the upcoming roll of this pack type must be forced to the qualifying rarity.
     */
    public boolean shouldForce(String playerId, PackType packType) {
        return runExclusive(playerId, () -> stateFor(playerId, packType).mustForceNext());
    }

    /**
     * Reset the counter if {@code achievedRarity} qualifies for the pack type, otherwise
     * increment it.
     *
     * @return the updated state
     */
    public PityState recordResult(String playerId, PackType packType, Rarity achievedRarity) {
        return runExclusive(playerId, () -> {
            PityState updated = stateFor(playerId, packType).afterRoll(packType.qualifies(achievedRarity));
            statesFor(playerId).put(packType.getName(), updated);
            return updated;
        });
    }

    public PityState currentState(String playerId, PackType packType) {
        return runExclusive(playerId, () -> stateFor(playerId, packType));
    }

    /**
     * Copy of every counter of the player, keyed by pack type name.
     */
    public Map<String, PityState> snapshot(String playerId) {
        return runExclusive(playerId, () -> Map.copyOf(statesFor(playerId)));
    }

    /**
     * Write the player's cached counters to the store.
     *
     * On failure the player is queued for {@link #retryPendingSaves(int)} and the exception is
     * rethrown; the cached counters are kept as they are.
     *
     * @throws TransientPersistenceException if the store fails or times out
     */
    public void persist(String playerId) {
        ReentrantLock lock = acquire(playerId);
        try {
            Map<String, PityState> states = Map.copyOf(statesFor(playerId));
            CompletableFuture<Void> save = chainSave(playerId, states);
            awaitSave(playerId, save);
            saveChains.remove(playerId, save);
            pendingSaves.remove(playerId);
        } catch (TransientPersistenceException e) {
            pendingSaves.merge(playerId, 1, Integer::sum);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retry every queued save once.
     *
     * @param maxAttempts attempts after which a player is dropped from the queue
     * @return events for the players whose saves exhausted their attempts during this pass
     */
    public List<PityReconciliationRequiredEvent> retryPendingSaves(int maxAttempts) {
        List<PityReconciliationRequiredEvent> exhausted = new ArrayList<>();
        for (String playerId : List.copyOf(pendingSaves.keySet())) {
            try {
                persist(playerId);
                log.info("Persisted pity state for player {} on retry", playerId);
            } catch (TransientPersistenceException e) {
                int attempts = pendingSaves.getOrDefault(playerId, maxAttempts);
                if (attempts >= maxAttempts) {
                    pendingSaves.remove(playerId);
                    exhausted.add(new PityReconciliationRequiredEvent(playerId, snapshot(playerId), attempts));
                } else {
                    log.warn("Retry {} of pity save for player {} failed: {}", attempts, playerId, e.getMessage());
                }
            }
        }
        return exhausted;
    }

    public boolean hasPendingSave(String playerId) {
        return pendingSaves.containsKey(playerId);
    }

    public int pendingSaveCount() {
        return pendingSaves.size();
    }

    /**
     * Drop the cached counters and lock of players not accessed for {@code maxIdle}.
     *
     * Players with a queued or still running save, or whose lock is held, are kept.
     *
     * @return the number of evicted players
     */
    public int evictIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int evicted = 0;
        for (Map.Entry<String, Instant> entry : List.copyOf(lastAccess.entrySet())) {
            String playerId = entry.getKey();
            if (entry.getValue().isAfter(cutoff) || pendingSaves.containsKey(playerId)) {
                continue;
            }
            CompletableFuture<Void> running = saveChains.get(playerId);
            if (running != null && !running.isDone()) {
                continue;
            }
            ReentrantLock lock = locks.get(playerId);
            if (lock == null || !lock.tryLock()) {
                continue;
            }
            try {
                Instant seen = lastAccess.get(playerId);
                if (locks.get(playerId) != lock || seen == null || seen.isAfter(cutoff)) {
                    continue;
                }
                cache.remove(playerId);
                saveChains.remove(playerId);
                lastAccess.remove(playerId);
                locks.remove(playerId, lock);
                evicted++;
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            log.debug("Evicted pity state of {} idle players", evicted);
        }
        return evicted;
    }

    public int cachedPlayerCount() {
        return cache.size();
    }

    // Returns the player's lock, held by the caller. Retries when the lock was evicted
    // between lookup and acquisition.
    private ReentrantLock acquire(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id is required");
        }
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(playerId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(playerId) == lock) {
                lastAccess.put(playerId, clock.instant());
                return lock;
            }
            lock.unlock();
        }
    }

    // Caller holds the player's lock.
    private CompletableFuture<Void> chainSave(String playerId, Map<String, PityState> states) {
        CompletableFuture<Void> previous = saveChains.get(playerId);
        CompletableFuture<Void> ready = previous == null
            ? CompletableFuture.completedFuture(null)
            : previous.handle((ignored, error) -> null);
        CompletableFuture<Void> save = ready.thenRunAsync(() -> store.save(playerId, states), storeExecutor);
        saveChains.put(playerId, save);
        return save;
    }

    // Timed out saves are left running so the chain keeps its order.
    private void awaitSave(String playerId, CompletableFuture<Void> save) {
        try {
            save.get(storeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Pity store save for player {} timed out after {}", playerId, storeTimeout);
            throw new TransientPersistenceException("Pity store timed out during save", playerId, "save", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientPersistenceException("Interrupted during pity store save", playerId, "save", e);
        } catch (ExecutionException e) {
            log.warn("Pity store save for player {} failed: {}", playerId, e.getCause().getMessage());
            throw new TransientPersistenceException("Pity store failed during save", playerId, "save", e.getCause());
        }
    }

    // Caller holds the player's lock.
    private Map<String, PityState> statesFor(String playerId) {
        Map<String, PityState> states = cache.get(playerId);
        if (states == null) {
            Map<String, PityState> loaded = callStore(playerId, "load", () -> store.load(playerId));
            states = new HashMap<>(loaded);
            cache.put(playerId, states);
            log.debug("Loaded {} pity counters for player {}", states.size(), playerId);
        }
        return states;
    }

    // Caller holds the player's lock.
    private PityState stateFor(String playerId, PackType packType) {
        Map<String, PityState> states = statesFor(playerId);
        PityState state = states.get(packType.getName());
        if (state == null) {
            return PityState.initial(packType.getPityThreshold());
        }
        PityState anchored = state.withThreshold(packType.getPityThreshold());
        if (anchored != state) {
            states.put(packType.getName(), anchored);
        }
        return anchored;
    }

    private <T> T callStore(String playerId, String operation, Callable<T> call) {
        Future<T> future;
        try {
            future = storeExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new TransientPersistenceException("Pity store executor rejected " + operation, playerId, operation, e);
        }
        try {
            return future.get(storeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Pity store {} for player {} timed out after {}", operation, playerId, storeTimeout);
            throw new TransientPersistenceException("Pity store timed out during " + operation, playerId, operation, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientPersistenceException("Interrupted during pity store " + operation, playerId, operation, e);
        } catch (ExecutionException e) {
            log.warn("Pity store {} for player {} failed: {}", operation, playerId, e.getCause().getMessage());
            throw new TransientPersistenceException("Pity store failed during " + operation, playerId, operation, e.getCause());
        }
    }
}
