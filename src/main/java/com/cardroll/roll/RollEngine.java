package com.cardroll.roll;

import com.cardroll.catalog.Card;
import com.cardroll.catalog.CardCatalog;
import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ConfigurationException;
import com.cardroll.common.exception.TransientPersistenceException;
import com.cardroll.common.exception.ValidationException;
import com.cardroll.common.random.RandomSource;
import com.cardroll.pack.PackType;
import com.cardroll.pack.PackTypeRegistry;
import com.cardroll.pity.PityState;
import com.cardroll.pity.PityTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a roll request into a sequence of cards.
 *
 * Roll flow, per slot and strictly in order:
 * 1. Ask the pity tracker whether the slot must be forced
 * 2. Force the pack's qualifying rarity, or sample one from the pack's distribution
 * 3. Pick a card of that rarity uniformly from the pack's pool
 * 4. Record the achieved rarity before moving on to the next slot
 *
 * The whole batch, including the save of the pity counters, runs under the player's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RollEngine {

    private final PackTypeRegistry packTypeRegistry;
    private final CardCatalog cardCatalog;
    private final PityTracker pityTracker;
    private final RandomSource randomSource;

    /**
     * Roll {@code count} cards of the named pack type for a player.
     *
     * @throws ValidationException if the pack type is unknown or the count is out of range
     * @throws ConfigurationException if the pack's pool has no card for a resolved rarity
     * @throws TransientPersistenceException if the player's counters could not be loaded
     */
    public RollResult roll(String playerId, String packTypeName, int count) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("Player id is required");
        }
        PackType packType = packTypeRegistry.get(packTypeName);
        if (count < 1 || count > packType.getMaxBatchSize()) {
            throw new ValidationException(String.format("Card count must be between 1 and %d, was %d",
                packType.getMaxBatchSize(), count));
        }

        return pityTracker.runExclusive(playerId, () -> {
            List<RolledCard> cards = rollBatch(playerId, packType, count);
            PityState finalState = pityTracker.currentState(playerId, packType);

            boolean pending = false;
            try {
                pityTracker.persist(playerId);
            } catch (TransientPersistenceException e) {
                log.warn("Roll for player {} delivered but pity save failed, queued for retry: {}",
                    playerId, e.getMessage());
                pending = true;
            }

            RollResult result = RollResult.builder()
                .playerId(playerId)
                .packType(packType.getName())
                .cards(Collections.unmodifiableList(cards))
                .pityCounter(finalState.getCounter())
                .pityThreshold(finalState.getThreshold())
                .totalValue(totalValue(cards, packType))
                .rarityBreakdown(rarityBreakdown(cards))
                .persistencePending(pending)
                .build();

            log.info("Player {} rolled {} {} card(s), {} forced, pity {}/{}",
                playerId, count, packType.getName(), result.forcedCount(),
                finalState.getCounter(), finalState.getThreshold());
            return result;
        });
    }

    private List<RolledCard> rollBatch(String playerId, PackType packType, int count) {
        List<RolledCard> cards = new ArrayList<>(count);
        for (int slot = 0; slot < count; slot++) {
            boolean forced = pityTracker.shouldForce(playerId, packType);
            Rarity rarity = forced
                ? packType.getQualifyingRarity()
                : packType.getDistribution().sample(randomSource);

            Card card = resolveCard(packType, rarity);
            PityState state = pityTracker.recordResult(playerId, packType, rarity);

            log.debug("Slot {} for player {}: {} {} (forced={}, pity={})",
                slot, playerId, rarity.getId(), card.getId(), forced, state.getCounter());
            cards.add(new RolledCard(card, forced));
        }
        return cards;
    }

    private Card resolveCard(PackType packType, Rarity rarity) {
        List<Card> pool = cardCatalog.listByRarityAndPack(rarity, packType.getName());
        if (pool == null || pool.isEmpty()) {
            throw new ConfigurationException(String.format("No %s card available for pack type %s",
                rarity.getId(), packType.getName()));
        }
        return pool.get(randomSource.nextInt(pool.size()));
    }

    private long totalValue(List<RolledCard> cards, PackType packType) {
        double total = cards.stream()
            .mapToDouble(rolled -> rolled.getCard().getRarity().getValue() * packType.getValueMultiplier())
            .sum();
        return Math.round(total);
    }

    private Map<Rarity, Integer> rarityBreakdown(List<RolledCard> cards) {
        Map<Rarity, Integer> breakdown = new EnumMap<>(Rarity.class);
        cards.forEach(rolled -> breakdown.merge(rolled.getCard().getRarity(), 1, Integer::sum));
        return Collections.unmodifiableMap(breakdown);
    }
}
