package com.cardroll.deck;

import com.cardroll.catalog.CardCatalog;
import com.cardroll.collection.CollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for validating decks against a player's collection and managing the active deck.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckService {

    private final DeckValidator deckValidator;
    private final CollectionService collectionService;
    private final ActiveDeckRepository activeDeckRepository;
    private final CardCatalog cardCatalog;

    @Transactional(readOnly = true)
    public DeckValidationResult validate(String playerId, List<String> cardIds) {
        return deckValidator.validate(Deck.of(cardIds), collectionService.getOwnedCardIds(playerId));
    }

    /**
     * Replace the player's active deck.
     *
     * @throws DeckValidationException if the deck breaks a composition constraint
     */
    @Transactional
    public ActiveDeck setActiveDeck(String playerId, List<String> cardIds) {
        Deck deck = Deck.of(cardIds);
        DeckValidationResult result = deckValidator.validate(deck, collectionService.getOwnedCardIds(playerId));
        if (!result.isValid()) {
            log.info("Rejected active deck for player {}: {}", playerId, result.getReason());
            throw new DeckValidationException(result);
        }

        ActiveDeck activeDeck = activeDeckRepository.findById(playerId)
            .orElseGet(() -> new ActiveDeck(playerId));
        activeDeck.replaceWith(deck);
        activeDeckRepository.save(activeDeck);

        log.info("Player {} activated a deck of {} cards", playerId, deck.getSize());
        return activeDeck;
    }

    @Transactional(readOnly = true)
    public Optional<ActiveDeck> getActiveDeck(String playerId) {
        return activeDeckRepository.findById(playerId);
    }

    /**
     * Sum of the costs of the cards in the deck.
     */
    public int totalCost(List<String> cardIds) {
        return cardIds.stream()
            .mapToInt(id -> cardCatalog.getById(id).getCost())
            .sum();
    }
}
