package com.cardroll.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Rarity tiers, declared from lowest to highest.
 * Declaration order is the tier order used for sampling and comparisons.
 */
public enum Rarity {
    COMMON("common", 10),
    UNCOMMON("uncommon", 25),
    RARE("rare", 50),
    EPIC("epic", 100),
    LEGENDARY("legendary", 250),
    MYTHIC("mythic", 500),
    COSMIC("cosmic", 1000);

    private final String id;
    private final int value;

    Rarity(String id, int value) {
        this.id = id;
        this.value = value;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Base value of a card of this rarity, before the pack multiplier.
     */
    public int getValue() {
        return value;
    }

    public boolean isAtLeast(Rarity other) {
        return compareTo(other) >= 0;
    }

    public static Optional<Rarity> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(r -> r.id.equals(normalized))
            .findFirst();
    }

    @JsonCreator
    static Rarity fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown rarity: " + id));
    }
}
