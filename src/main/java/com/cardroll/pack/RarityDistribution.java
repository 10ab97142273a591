package com.cardroll.pack;

import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ConfigurationException;
import com.cardroll.common.random.RandomSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Weighted probability table over rarity tiers.
 *
 * Weights are validated once on construction: each must be non-negative and together
 * they must sum to 1 within {@link #TOLERANCE}. Sampling uses cumulative-weight inversion
 * over the tiers in ascending order, so a given draw always maps to the same tier.
 */
public final class RarityDistribution {

    public static final double TOLERANCE = 1.0e-6;

    private static final Rarity[] TIERS = Rarity.values();

    private final Map<Rarity, Double> weights;
    private final double[] cumulative;

    private RarityDistribution(Map<Rarity, Double> weights, double[] cumulative) {
        this.weights = weights;
        this.cumulative = cumulative;
    }

    /**
     * Build a distribution from a weight table. Tiers absent from the table get weight 0.
     *
     * @throws ConfigurationException if a weight is negative or the weights do not sum to 1
     */
    public static RarityDistribution of(Map<Rarity, Double> table) {
        if (table == null || table.isEmpty()) {
            throw new ConfigurationException("Rarity weight table is empty");
        }

        EnumMap<Rarity, Double> copy = new EnumMap<>(Rarity.class);
        double[] cumulative = new double[TIERS.length];
        double running = 0.0;

        for (int i = 0; i < TIERS.length; i++) {
            Double weight = table.get(TIERS[i]);
            double w = weight == null ? 0.0 : weight;
            if (Double.isNaN(w) || w < 0.0) {
                throw new ConfigurationException(
                    String.format("Weight for rarity %s must be non-negative, was %s", TIERS[i].getId(), w));
            }
            copy.put(TIERS[i], w);
            running += w;
            cumulative[i] = running;
        }

        if (Math.abs(running - 1.0) > TOLERANCE) {
            throw new ConfigurationException(
                String.format("Rarity weights must sum to 1, but sum to %.6f", running));
        }

        return new RarityDistribution(Collections.unmodifiableMap(copy), cumulative);
    }

    /**
     * Draw a rarity. Consumes exactly one {@code nextDouble()} from the source.
     */
    public Rarity sample(RandomSource random) {
        double draw = random.nextDouble();
        for (int i = 0; i < TIERS.length; i++) {
            if (cumulative[i] > draw) {
                return TIERS[i];
            }
        }
        // Rounding left the last cumulative value slightly below the draw.
        return highestReachable();
    }

    public double weightOf(Rarity rarity) {
        return weights.get(rarity);
    }

    public Map<Rarity, Double> getWeights() {
        return weights;
    }

    /**
     * Tiers that can come out of {@link #sample(RandomSource)}.
     */
    public Set<Rarity> reachableRarities() {
        EnumSet<Rarity> reachable = EnumSet.noneOf(Rarity.class);
        weights.forEach((rarity, weight) -> {
            if (weight > 0.0) {
                reachable.add(rarity);
            }
        });
        return reachable;
    }

    private Rarity highestReachable() {
        for (int i = TIERS.length - 1; i >= 0; i--) {
            if (weights.get(TIERS[i]) > 0.0) {
                return TIERS[i];
            }
        }
        return TIERS[0];
    }

    @Override
    public String toString() {
        return "RarityDistribution" + weights + " cumulative=" + Arrays.toString(cumulative);
    }
}
