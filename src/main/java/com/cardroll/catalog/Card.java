package com.cardroll.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A card definition from the catalog.
 *
 * Immutable once loaded; a player's collection refers to cards by {@link #getId()}.
 */
@Value
@Builder
public class Card {

    String id;
    String name;
    String description;
    String emoji;
    Rarity rarity;
    CardType type;
    int cost;
    int attack;
    int defense;
    int health;

    @Singular
    List<String> effects;

    @Singular
    Set<String> tags;

    public boolean hasAnyTag(Set<String> candidates) {
        return candidates.stream().anyMatch(tags::contains);
    }
}
