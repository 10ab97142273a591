package com.cardroll.config;

import com.cardroll.catalog.CardCatalog;
import com.cardroll.catalog.CardCatalogLoader;
import com.cardroll.catalog.CardType;
import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ConfigurationException;
import com.cardroll.common.random.JdkRandomSource;
import com.cardroll.common.random.RandomSource;
import com.cardroll.deck.DeckLimits;
import com.cardroll.pack.CardPoolFilter;
import com.cardroll.pack.PackType;
import com.cardroll.pack.PackTypeRegistry;
import com.cardroll.pack.RarityDistribution;
import com.cardroll.pity.PityStore;
import com.cardroll.pity.PityTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Builds the immutable engine structures from {@link CardRollProperties}.
 * Any inconsistency fails the context with a {@link ConfigurationException}.
 */
@Configuration
@Slf4j
public class CardRollConfiguration {

    @Bean
    public PackTypeRegistry packTypeRegistry(CardRollProperties properties) {
        List<PackType> packTypes = new ArrayList<>();
        properties.getPacks().forEach((name, pack) -> packTypes.add(toPackType(name, pack)));
        PackTypeRegistry registry = new PackTypeRegistry(packTypes);
        log.info("Loaded pack types: {}", packTypes.stream().map(PackType::getName).collect(Collectors.toList()));
        return registry;
    }

    @Bean
    public CardCatalog cardCatalog(CardRollProperties properties, PackTypeRegistry packTypeRegistry,
                                   ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        CardCatalogLoader loader = new CardCatalogLoader(objectMapper);
        CardCatalog catalog = CardCatalog.build(
            loader.load(resourceLoader.getResource(properties.getCatalog().getLocation())),
            packTypeRegistry.all());
        log.info("Card catalog ready with {} cards: {}", catalog.size(), catalog.countByRarity());
        return catalog;
    }

    @Bean
    public DeckLimits deckLimits(CardRollProperties properties) {
        Map<Rarity, Integer> maxCopies = new EnumMap<>(Rarity.class);
        properties.getDeck().getMaxCopies().forEach((rarityId, limit) ->
            maxCopies.put(parseRarity(rarityId, "deck copy limits"), limit));
        return DeckLimits.of(properties.getDeck().getMaxSize(), maxCopies);
    }

    @Bean
    public RandomSource randomSource(CardRollProperties properties) {
        Long seed = properties.getRandom().getSeed();
        if (seed != null) {
            log.warn("Rolling with fixed seed {}; results are reproducible", seed);
            return JdkRandomSource.seeded(seed);
        }
        return JdkRandomSource.secure();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pityStoreExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pity-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public PityTracker pityTracker(PityStore pityStore, ExecutorService pityStoreExecutor,
                                   CardRollProperties properties) {
        return new PityTracker(pityStore, pityStoreExecutor, properties.getPity().getStoreTimeout());
    }

    static PackType toPackType(String name, CardRollProperties.Pack pack) {
        Map<Rarity, Double> weights = new EnumMap<>(Rarity.class);
        pack.getWeights().forEach((rarityId, weight) ->
            weights.put(parseRarity(rarityId, "pack type " + name), weight));

        Set<CardType> allowedTypes = pack.getAllowedTypes().stream()
            .map(type -> CardType.fromId(type).orElseThrow(() ->
                new ConfigurationException("Unknown card type " + type + " in pack type " + name)))
            .collect(Collectors.toSet());

        try {
            return PackType.builder()
                .name(name)
                .maxBatchSize(pack.getMaxBatchSize())
                .distribution(RarityDistribution.of(weights))
                .poolFilter(CardPoolFilter.of(allowedTypes, Set.copyOf(pack.getRequiredTags())))
                .qualifyingRarity(parseRarity(pack.getQualifyingRarity(), "pack type " + name))
                .pityThreshold(pack.getPityThreshold())
                .valueMultiplier(pack.getValueMultiplier())
                .build();
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Invalid pack type " + name + ": " + e.getMessage(), e);
        }
    }

    private static Rarity parseRarity(String rarityId, String context) {
        return Rarity.fromId(rarityId)
            .orElseThrow(() -> new ConfigurationException("Unknown rarity " + rarityId + " in " + context));
    }
}
