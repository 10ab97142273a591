package com.cardroll.support;

import com.cardroll.catalog.Card;
import com.cardroll.catalog.CardType;
import com.cardroll.catalog.Rarity;
import com.cardroll.pack.CardPoolFilter;
import com.cardroll.pack.PackType;
import com.cardroll.pack.RarityDistribution;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cards and pack types shared by the unit tests.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static Card card(String id, Rarity rarity) {
        return card(id, rarity, CardType.CREATURE);
    }

    public static Card card(String id, Rarity rarity, CardType type) {
        return Card.builder()
            .id(id)
            .name("Card " + id)
            .rarity(rarity)
            .type(type)
            .cost(rarity.ordinal() + 1)
            .attack(1)
            .defense(1)
            .health(1)
            .tag("test")
            .build();
    }

    /**
     * Two creatures and one spell per rarity, ids like {@code epic-1}, {@code epic-2}, {@code epic-spell}.
     */
    public static List<Card> standardCards() {
        List<Card> cards = new ArrayList<>();
        for (Rarity rarity : Rarity.values()) {
            cards.add(card(rarity.getId() + "-1", rarity));
            cards.add(card(rarity.getId() + "-2", rarity));
            cards.add(card(rarity.getId() + "-spell", rarity, CardType.SPELL));
        }
        return cards;
    }

    /**
     * common 0.60, uncommon 0.25, rare 0.10, epic 0.04, legendary 0.01; epic qualifies, threshold 50.
     */
    public static PackType basicPack() {
        Map<Rarity, Double> weights = new EnumMap<>(Rarity.class);
        weights.put(Rarity.COMMON, 0.60);
        weights.put(Rarity.UNCOMMON, 0.25);
        weights.put(Rarity.RARE, 0.10);
        weights.put(Rarity.EPIC, 0.04);
        weights.put(Rarity.LEGENDARY, 0.01);
        return PackType.builder()
            .name("basic")
            .maxBatchSize(10)
            .distribution(RarityDistribution.of(weights))
            .qualifyingRarity(Rarity.EPIC)
            .pityThreshold(50)
            .valueMultiplier(1.0)
            .build();
    }

    /**
     * Only ever samples common cards; cosmic qualifies, so every counter change comes from
     * non-qualifying results until pity forces a cosmic card.
     */
    public static PackType grindPack(int threshold) {
        return PackType.builder()
            .name("grind")
            .maxBatchSize(10)
            .distribution(RarityDistribution.of(Map.of(Rarity.COMMON, 1.0)))
            .qualifyingRarity(Rarity.COSMIC)
            .pityThreshold(threshold)
            .valueMultiplier(1.5)
            .build();
    }

    public static PackType spellPack() {
        return PackType.builder()
            .name("spells")
            .maxBatchSize(5)
            .distribution(RarityDistribution.of(Map.of(Rarity.COMMON, 0.5, Rarity.RARE, 0.5)))
            .poolFilter(CardPoolFilter.of(Set.of(CardType.SPELL), Set.of()))
            .qualifyingRarity(Rarity.RARE)
            .pityThreshold(10)
            .build();
    }
}
