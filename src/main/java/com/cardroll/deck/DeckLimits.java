package com.cardroll.deck;

import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ConfigurationException;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Deck composition limits, loaded once at startup.
 */
@Value
public class DeckLimits {

    int maxDeckSize;
    Map<Rarity, Integer> maxCopies;

    public static DeckLimits of(int maxDeckSize, Map<Rarity, Integer> maxCopies) {
        if (maxDeckSize < 1) {
            throw new ConfigurationException("Maximum deck size must be at least 1");
        }
        EnumMap<Rarity, Integer> copies = new EnumMap<>(Rarity.class);
        for (Rarity rarity : Rarity.values()) {
            Integer limit = maxCopies.get(rarity);
            if (limit == null || limit < 1) {
                throw new ConfigurationException("Missing or invalid copy limit for rarity " + rarity.getId());
            }
            copies.put(rarity, limit);
        }
        return new DeckLimits(maxDeckSize, Collections.unmodifiableMap(copies));
    }

    public int maxCopiesFor(Rarity rarity) {
        return maxCopies.get(rarity);
    }
}
