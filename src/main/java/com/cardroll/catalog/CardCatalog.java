package com.cardroll.catalog;

import com.cardroll.common.exception.CardNotFoundException;
import com.cardroll.common.exception.ConfigurationException;
import com.cardroll.common.exception.ValidationException;
import com.cardroll.pack.PackType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only lookup of every card definition, indexed by id, rarity and pack type.
 *
 * Built once from the card definitions and the configured pack types. A balance patch
 * means building a new catalog, never mutating this one.
 */
public final class CardCatalog {

    public static final Comparator<Card> DISPLAY_ORDER = Comparator
        .comparing(Card::getRarity)
        .thenComparingInt(Card::getCost)
        .thenComparing(Card::getName);

    private final Map<String, Card> byId;
    private final Map<Rarity, List<Card>> byRarity;
    private final Map<String, Map<Rarity, List<Card>>> byPack;

    private CardCatalog(Map<String, Card> byId, Map<Rarity, List<Card>> byRarity,
                        Map<String, Map<Rarity, List<Card>>> byPack) {
        this.byId = byId;
        this.byRarity = byRarity;
        this.byPack = byPack;
    }

    /**
     * Build the catalog and check it can serve every configured pack type.
     *
     * @throws ConfigurationException on duplicate or incomplete card definitions, or when a pack
     *         type can reach (by sampling or by pity) a rarity its pool has no card for
     */
    public static CardCatalog build(Collection<Card> cards, Collection<PackType> packTypes) {
        Map<String, Card> byId = new LinkedHashMap<>();
        for (Card card : cards) {
            checkDefinition(card);
            if (byId.put(card.getId(), card) != null) {
                throw new ConfigurationException("Duplicate card id in catalog: " + card.getId());
            }
        }

        Map<Rarity, List<Card>> byRarity = indexByRarity(byId.values());

        Map<String, Map<Rarity, List<Card>>> byPack = new LinkedHashMap<>();
        for (PackType packType : packTypes) {
            List<Card> pool = byId.values().stream()
                .filter(packType.getPoolFilter()::matches)
                .collect(Collectors.toList());
            Map<Rarity, List<Card>> packIndex = indexByRarity(pool);

            Set<Rarity> required = EnumSet.of(packType.getQualifyingRarity());
            required.addAll(packType.getDistribution().reachableRarities());
            for (Rarity rarity : required) {
                if (packIndex.get(rarity).isEmpty()) {
                    throw new ConfigurationException(String.format(
                        "Pack type %s can yield rarity %s but its card pool has no %s card",
                        packType.getName(), rarity.getId(), rarity.getId()));
                }
            }
            byPack.put(packType.getName(), packIndex);
        }

        return new CardCatalog(
            Collections.unmodifiableMap(byId),
            byRarity,
            Collections.unmodifiableMap(byPack));
    }

    public Optional<Card> findById(String id) {
        return Optional.ofNullable(id).map(byId::get);
    }

    /**
     * @throws CardNotFoundException if the id is unknown
     */
    public Card getById(String id) {
        return findById(id).orElseThrow(() -> new CardNotFoundException(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /**
     * Cards of the given rarity that the named pack type may hand out.
     * Non-empty for every rarity the pack type can yield.
     */
    public List<Card> listByRarityAndPack(Rarity rarity, String packTypeName) {
        Map<Rarity, List<Card>> packIndex = byPack.get(packTypeName);
        if (packIndex == null) {
            throw new ValidationException("Unknown pack type: " + packTypeName);
        }
        return packIndex.get(rarity);
    }

    public List<Card> listByRarity(Rarity rarity) {
        return byRarity.get(rarity);
    }

    public Collection<Card> all() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    /**
     * Filter the catalog for browsing. Null criteria are ignored; the text matches name,
     * description or tags, case-insensitively.
     */
    public List<Card> search(Rarity rarity, CardType type, String text) {
        String needle = text == null || text.isBlank() ? null : text.trim().toLowerCase(Locale.ROOT);
        return byId.values().stream()
            .filter(card -> rarity == null || card.getRarity() == rarity)
            .filter(card -> type == null || card.getType() == type)
            .filter(card -> needle == null || matchesText(card, needle))
            .sorted(DISPLAY_ORDER)
            .collect(Collectors.toList());
    }

    public Map<Rarity, Long> countByRarity() {
        Map<Rarity, Long> counts = new EnumMap<>(Rarity.class);
        byRarity.forEach((rarity, list) -> counts.put(rarity, (long) list.size()));
        return counts;
    }

    public Map<CardType, Long> countByType() {
        Map<CardType, Long> counts = new EnumMap<>(CardType.class);
        for (CardType type : CardType.values()) {
            counts.put(type, 0L);
        }
        byId.values().forEach(card -> counts.merge(card.getType(), 1L, Long::sum));
        return counts;
    }

    private static boolean matchesText(Card card, String needle) {
        if (card.getName().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        if (card.getDescription() != null && card.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return card.getTags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).equals(needle));
    }

    private static void checkDefinition(Card card) {
        if (card.getId() == null || card.getId().isBlank()) {
            throw new ConfigurationException("Card definition without id: " + card.getName());
        }
        if (card.getName() == null || card.getName().isBlank()) {
            throw new ConfigurationException("Card " + card.getId() + " has no name");
        }
        if (card.getRarity() == null || card.getType() == null) {
            throw new ConfigurationException("Card " + card.getId() + " needs both a rarity and a type");
        }
        if (card.getCost() < 0) {
            throw new ConfigurationException("Card " + card.getId() + " has a negative cost");
        }
    }

    private static Map<Rarity, List<Card>> indexByRarity(Collection<Card> cards) {
        Map<Rarity, List<Card>> grouped = cards.stream()
            .collect(Collectors.groupingBy(Card::getRarity, () -> new EnumMap<>(Rarity.class),
                Collectors.toCollection(ArrayList::new)));
        Map<Rarity, List<Card>> index = new EnumMap<>(Rarity.class);
        for (Rarity rarity : Rarity.values()) {
            List<Card> list = grouped.getOrDefault(rarity, new ArrayList<>());
            list.sort(Comparator.comparing(Card::getId));
            index.put(rarity, List.copyOf(list));
        }
        return Collections.unmodifiableMap(index);
    }
}
