package com.cardroll.roll;

import com.cardroll.catalog.Rarity;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one roll request, in slot order.
 *
 * Not retained by the engine: storing the cards into the player's collection is up to the caller.
 */
@Value
@Builder
public class RollResult {

    String playerId;
    String packType;
    List<RolledCard> cards;

    /**
     * Pity counter of the pack type after the last slot.
     */
    int pityCounter;
    int pityThreshold;

    /**
     * Sum of the rarity values of the rolled cards times the pack multiplier, rounded.
     */
    long totalValue;

    Map<Rarity, Integer> rarityBreakdown;

    /**
     * True when the pity counters could not be saved; the save is retried in the background.
     */
    boolean persistencePending;

    public int getCount() {
        return cards.size();
    }

    public long forcedCount() {
        return cards.stream().filter(RolledCard::isForced).count();
    }
}
