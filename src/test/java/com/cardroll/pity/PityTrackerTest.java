package com.cardroll.pity;

import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.TransientPersistenceException;
import com.cardroll.pack.PackType;
import com.cardroll.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-player pity counters and their persistence.
 */
class PityTrackerTest {

    private static final String PLAYER = "player-1";

    private InMemoryPityStore store;
    private ExecutorService executor;
    private PityTracker tracker;
    private PackType basic;

    @BeforeEach
    void setUp() {
        store = new InMemoryPityStore();
        executor = Executors.newCachedThreadPool();
        tracker = new PityTracker(store, executor, Duration.ofSeconds(2));
        basic = TestFixtures.basicPack();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testNonQualifyingResultIncrementsCounter() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        PityState state = tracker.recordResult(PLAYER, basic, Rarity.RARE);

        assertEquals(2, state.getCounter());
        assertEquals(50, state.getThreshold());
    }

    @Test
    void testQualifyingOrHigherResultResetsCounter() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        assertEquals(0, tracker.recordResult(PLAYER, basic, Rarity.EPIC).getCounter());

        tracker.recordResult(PLAYER, basic, Rarity.UNCOMMON);
        assertEquals(0, tracker.recordResult(PLAYER, basic, Rarity.LEGENDARY).getCounter());
    }

    @Test
    void testForceIsRequiredOnceCounterReachesThresholdMinusOne() {
        for (int i = 0; i < 48; i++) {
            tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        }
        assertFalse(tracker.shouldForce(PLAYER, basic));

        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        assertTrue(tracker.shouldForce(PLAYER, basic));
    }

    @Test
    void testUnknownPlayerStartsAtZero() {
        PityState state = tracker.currentState("newcomer", basic);

        assertEquals(0, state.getCounter());
        assertFalse(tracker.shouldForce("newcomer", basic));
        assertTrue(tracker.snapshot("newcomer").isEmpty());
    }

    @Test
    void testStoredCountersAreLoadedOnFirstAccess() {
        store.save(PLAYER, Map.of("basic", PityState.of(49, 50)));

        assertTrue(tracker.shouldForce(PLAYER, basic));
        assertEquals(49, tracker.currentState(PLAYER, basic).getCounter());
    }

    @Test
    void testStoredCounterIsReanchoredOnLowerThreshold() {
        store.save(PLAYER, Map.of("grind", PityState.of(40, 50)));
        PackType grind = TestFixtures.grindPack(10);

        PityState state = tracker.currentState(PLAYER, grind);

        assertEquals(10, state.getThreshold());
        assertEquals(10, state.getCounter());
        assertTrue(tracker.shouldForce(PLAYER, grind));
    }

    @Test
    void testCountersArePerPackType() {
        PackType grind = TestFixtures.grindPack(5);
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        tracker.recordResult(PLAYER, grind, Rarity.COMMON);
        tracker.recordResult(PLAYER, grind, Rarity.COMMON);

        Map<String, PityState> snapshot = tracker.snapshot(PLAYER);
        assertEquals(1, snapshot.get("basic").getCounter());
        assertEquals(2, snapshot.get("grind").getCounter());
    }

    @Test
    void testPersistWritesCountersToStore() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        tracker.persist(PLAYER);

        assertEquals(PityState.of(1, 50), store.stored(PLAYER).get("basic"));
        assertFalse(tracker.hasPendingSave(PLAYER));
    }

    @Test
    void testFailedPersistIsQueuedAndKeepsCachedState() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        store.setAvailable(false);

        TransientPersistenceException e = assertThrows(TransientPersistenceException.class,
            () -> tracker.persist(PLAYER));

        assertEquals(PLAYER, e.getPlayerId());
        assertEquals("save", e.getOperation());
        assertTrue(tracker.hasPendingSave(PLAYER));
        assertEquals(1, tracker.currentState(PLAYER, basic).getCounter());
    }

    @Test
    void testRetrySucceedsOnceStoreRecovers() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        store.setAvailable(false);
        assertThrows(TransientPersistenceException.class, () -> tracker.persist(PLAYER));

        store.setAvailable(true);
        List<PityReconciliationRequiredEvent> exhausted = tracker.retryPendingSaves(3);

        assertTrue(exhausted.isEmpty());
        assertEquals(0, tracker.pendingSaveCount());
        assertEquals(1, store.stored(PLAYER).get("basic").getCounter());
    }

    @Test
    void testRetryExhaustionReportsUnsavedState() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        store.setAvailable(false);
        assertThrows(TransientPersistenceException.class, () -> tracker.persist(PLAYER));

        assertTrue(tracker.retryPendingSaves(3).isEmpty());
        List<PityReconciliationRequiredEvent> exhausted = tracker.retryPendingSaves(3);

        assertEquals(1, exhausted.size());
        PityReconciliationRequiredEvent event = exhausted.get(0);
        assertEquals(PLAYER, event.getPlayerId());
        assertEquals(3, event.getAttempts());
        assertEquals(1, event.getUnsavedStates().get("basic").getCounter());
        assertFalse(tracker.hasPendingSave(PLAYER));
    }

    @Test
    void testFailedActionRestoresCounters() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);

        assertThrows(IllegalStateException.class, () -> tracker.runExclusive(PLAYER, () -> {
            tracker.recordResult(PLAYER, basic, Rarity.COMMON);
            tracker.recordResult(PLAYER, basic, Rarity.COMMON);
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, tracker.currentState(PLAYER, basic).getCounter());
    }

    @Test
    void testUnavailableStoreOnLoadIsTransient() {
        store.setAvailable(false);

        TransientPersistenceException e = assertThrows(TransientPersistenceException.class,
            () -> tracker.currentState(PLAYER, basic));

        assertEquals("load", e.getOperation());
    }

    @Test
    void testSlowStoreTimesOut() {
        PityTracker impatient = new PityTracker(store, executor, Duration.ofMillis(50));
        store.setLatency(Duration.ofMillis(500));

        assertThrows(TransientPersistenceException.class, () -> impatient.currentState(PLAYER, basic));
    }

    @Test
    void testBlankPlayerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tracker.currentState(" ", basic));
    }

    @Test
    void testTimedOutSaveNeverOverwritesNewerSave() throws Exception {
        SlowFirstSaveStore slowStore = new SlowFirstSaveStore();
        PityTracker impatient = new PityTracker(slowStore, executor, Duration.ofMillis(100));

        impatient.recordResult(PLAYER, basic, Rarity.COMMON);
        assertThrows(TransientPersistenceException.class, () -> impatient.persist(PLAYER));
        impatient.recordResult(PLAYER, basic, Rarity.COMMON);
        assertThrows(TransientPersistenceException.class, () -> impatient.persist(PLAYER));

        slowStore.release.countDown();
        assertTrue(slowStore.awaitBothSaves(Duration.ofSeconds(5)));
        assertEquals(2, slowStore.saved.get(PLAYER).get("basic").getCounter());
    }

    @Test
    void testSaveWaitsForPreviousSaveOfSamePlayer() throws Exception {
        SlowFirstSaveStore slowStore = new SlowFirstSaveStore();
        PityTracker impatient = new PityTracker(slowStore, executor, Duration.ofMillis(100));
        impatient.recordResult(PLAYER, basic, Rarity.COMMON);
        assertThrows(TransientPersistenceException.class, () -> impatient.persist(PLAYER));

        slowStore.release.countDown();
        impatient.recordResult(PLAYER, basic, Rarity.COMMON);
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            while (true) {
                try {
                    impatient.persist(PLAYER);
                    return;
                } catch (TransientPersistenceException e) {
                    Thread.sleep(50);
                }
            }
        });

        assertEquals(2, slowStore.saved.get(PLAYER).get("basic").getCounter());
        assertFalse(impatient.hasPendingSave(PLAYER));
    }

    @Test
    void testIdlePlayersAreEvictedAndReloaded() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        PityTracker evicting = new PityTracker(store, executor, Duration.ofSeconds(2), clock);
        evicting.recordResult(PLAYER, basic, Rarity.COMMON);
        evicting.persist(PLAYER);

        assertEquals(0, evicting.evictIdle(Duration.ofMinutes(30)));
        assertEquals(1, evicting.cachedPlayerCount());

        assertEquals(1, evicting.evictIdle(Duration.ZERO));
        assertEquals(0, evicting.cachedPlayerCount());
        assertEquals(1, evicting.currentState(PLAYER, basic).getCounter());
    }

    @Test
    void testPlayerWithPendingSaveIsNotEvicted() {
        tracker.recordResult(PLAYER, basic, Rarity.COMMON);
        store.setAvailable(false);
        assertThrows(TransientPersistenceException.class, () -> tracker.persist(PLAYER));

        assertEquals(0, tracker.evictIdle(Duration.ZERO));
        assertEquals(1, tracker.currentState(PLAYER, basic).getCounter());
    }

    /**
     * Store whose first save blocks until released and ignores interrupts, like a JDBC write.
     */
    private static class SlowFirstSaveStore implements PityStore {

        final Map<String, Map<String, PityState>> saved = new ConcurrentHashMap<>();
        final CountDownLatch release = new CountDownLatch(1);
        private final AtomicBoolean first = new AtomicBoolean(true);
        private final CountDownLatch saves = new CountDownLatch(2);

        @Override
        public Map<String, PityState> load(String playerId) {
            return Map.of();
        }

        @Override
        public void save(String playerId, Map<String, PityState> states) {
            if (first.getAndSet(false)) {
                awaitUninterruptibly(release);
            }
            saved.put(playerId, Map.copyOf(states));
            saves.countDown();
        }

        boolean awaitBothSaves(Duration timeout) throws InterruptedException {
            return saves.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private static void awaitUninterruptibly(CountDownLatch latch) {
            boolean interrupted = false;
            while (true) {
                try {
                    latch.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
