package com.cardroll.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration bound from the {@code card-roll} prefix.
 *
 * Only read while the application context starts; the engine works on the immutable
 * structures built from it in {@link CardRollConfiguration}.
 */
@Data
@ConfigurationProperties(prefix = "card-roll")
public class CardRollProperties {

    private Catalog catalog = new Catalog();

    /**
     * Pack types by name.
     */
    private Map<String, Pack> packs = new LinkedHashMap<>();

    private DeckRules deck = new DeckRules();

    private RandomSettings random = new RandomSettings();

    private Pity pity = new Pity();

    @Data
    public static class Catalog {
        private String location = "classpath:catalog/cards.json";
    }

    @Data
    public static class Pack {
        private int maxBatchSize = 10;

        /**
         * Rarity id to probability. Must sum to 1.
         */
        private Map<String, Double> weights = new LinkedHashMap<>();

        private String qualifyingRarity = "epic";
        private int pityThreshold = 50;
        private double valueMultiplier = 1.0;
        private List<String> allowedTypes = new ArrayList<>();
        private List<String> requiredTags = new ArrayList<>();
    }

    @Data
    public static class DeckRules {
        private int maxSize = 30;

        /**
         * Rarity id to the maximum copies of one card of that rarity.
         */
        private Map<String, Integer> maxCopies = new LinkedHashMap<>(Map.of(
            "common", 4,
            "uncommon", 3,
            "rare", 3,
            "epic", 2,
            "legendary", 1,
            "mythic", 1,
            "cosmic", 1));
    }

    @Data
    public static class RandomSettings {
        /**
         * Fixed seed for reproducible rolls. A secure random source is used when unset.
         */
        private Long seed;
    }

    @Data
    public static class Pity {
        private Duration storeTimeout = Duration.ofSeconds(2);
        private Duration retryInterval = Duration.ofSeconds(5);
        private int maxRetryAttempts = 5;

        /**
         * Players not seen for this long are dropped from the in-process pity cache.
         */
        private Duration idleEviction = Duration.ofMinutes(30);
        private Duration evictionInterval = Duration.ofMinutes(1);
    }
}
