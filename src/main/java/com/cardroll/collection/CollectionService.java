package com.cardroll.collection;

import com.cardroll.roll.RollResult;
import com.cardroll.roll.RolledCard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Service for the cards a player owns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionService {

    private final OwnedCardRepository ownedCardRepository;

    // Rolls whose cards could not be stored yet, oldest first.
    private final Queue<RollResult> pendingGrants = new ConcurrentLinkedQueue<>();

    /**
     * Add every card of a roll to the player's collection.
     */
    @Transactional
    public void addRolledCards(RollResult result) {
        Map<String, Integer> copies = new LinkedHashMap<>();
        for (RolledCard rolled : result.getCards()) {
            copies.merge(rolled.getCard().getId(), 1, Integer::sum);
        }

        copies.forEach((cardId, count) -> {
            OwnedCard owned = ownedCardRepository.findByPlayerIdAndCardId(result.getPlayerId(), cardId)
                .orElseGet(() -> new OwnedCard(result.getPlayerId(), cardId));
            owned.addCopies(count);
            ownedCardRepository.save(owned);
        });

        log.info("Added {} card(s) ({} distinct) to collection of player {}",
            result.getCount(), copies.size(), result.getPlayerId());
    }

    /**
     * Keep a roll whose cards could not be stored, for {@link CollectionGrantRetryJob}.
     */
    public void queueForRetry(RollResult result) {
        pendingGrants.add(result);
        log.warn("Queued {} card(s) of player {} for a later collection write",
            result.getCount(), result.getPlayerId());
    }

    public List<RollResult> drainPendingGrants() {
        List<RollResult> drained = new ArrayList<>();
        RollResult next;
        while ((next = pendingGrants.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int pendingGrantCount() {
        return pendingGrants.size();
    }

    @Transactional(readOnly = true)
    public List<OwnedCard> getCollection(String playerId) {
        return ownedCardRepository.findByPlayerId(playerId);
    }

    @Transactional(readOnly = true)
    public Set<String> getOwnedCardIds(String playerId) {
        return ownedCardRepository.findByPlayerId(playerId).stream()
            .filter(owned -> owned.getQuantity() > 0)
            .map(OwnedCard::getCardId)
            .collect(Collectors.toSet());
    }
}
