package com.cardroll.pack;

import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A named roll configuration. Loaded at startup and immutable thereafter.
 */
@Getter
@ToString
public class PackType {

    private final String name;

    /**
     * Maximum number of cards a single roll request may ask for.
     */
    private final int maxBatchSize;

    private final RarityDistribution distribution;

    private final CardPoolFilter poolFilter;

    /**
     * Minimum tier that resets the pity counter. Forced rolls yield exactly this tier.
     */
    private final Rarity qualifyingRarity;

    /**
     * Window within which a qualifying rarity is guaranteed.
     */
    private final int pityThreshold;

    private final double valueMultiplier;

    @Builder
    private PackType(String name, int maxBatchSize, RarityDistribution distribution, CardPoolFilter poolFilter,
                     Rarity qualifyingRarity, int pityThreshold, Double valueMultiplier) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Pack type name is required");
        }
        if (maxBatchSize < 1) {
            throw new ConfigurationException("Pack type " + name + " must allow at least one card per roll");
        }
        if (distribution == null) {
            throw new ConfigurationException("Pack type " + name + " has no rarity weights");
        }
        if (qualifyingRarity == null) {
            throw new ConfigurationException("Pack type " + name + " has no qualifying rarity");
        }
        if (pityThreshold < 1) {
            throw new ConfigurationException("Pack type " + name + " pity threshold must be at least 1");
        }
        this.name = name;
        this.maxBatchSize = maxBatchSize;
        this.distribution = distribution;
        this.poolFilter = poolFilter == null ? CardPoolFilter.any() : poolFilter;
        this.qualifyingRarity = qualifyingRarity;
        this.pityThreshold = pityThreshold;
        this.valueMultiplier = valueMultiplier == null ? 1.0 : valueMultiplier;
    }

    public boolean qualifies(Rarity rarity) {
        return rarity.isAtLeast(qualifyingRarity);
    }
}
