package com.cardroll.pity;

import lombok.Value;

import java.util.Map;

/**
 * Published when a player's pity counters could not be persisted after every retry.
 * The counters are the in-process values that never reached the store.
 */
@Value
public class PityReconciliationRequiredEvent {
    String playerId;
    Map<String, PityState> unsavedStates;
    int attempts;
}
