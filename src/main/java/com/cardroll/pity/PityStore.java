package com.cardroll.pity;

import java.util.Map;

/**
 * External storage for pity counters.
 *
 * Layout: player id → (pack type name → {@link PityState}). Implementations may block on I/O;
 * {@link PityTracker} bounds every call with a timeout.
 */
public interface PityStore {

    /**
     * Load all counters of a player.
     *
     * @return the stored counters, or an empty map for a player who never rolled
     */
    Map<String, PityState> load(String playerId);

    /**
     * Replace the stored counters of a player.
     */
    void save(String playerId, Map<String, PityState> states);
}
