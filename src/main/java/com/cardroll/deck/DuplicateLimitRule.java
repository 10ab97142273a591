package com.cardroll.deck;

import com.cardroll.catalog.Card;
import com.cardroll.catalog.CardCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Rule that caps the copies of a card by its rarity. Rarer cards allow fewer copies.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class DuplicateLimitRule implements DeckRule {

    private final CardCatalog cardCatalog;
    private final DeckLimits deckLimits;

    @Override
    public DeckValidationResult evaluate(Deck deck, Set<String> ownedCardIds) {
        for (Map.Entry<String, Integer> entry : deck.copiesPerCard().entrySet()) {
            Card card = cardCatalog.getById(entry.getKey());
            int limit = deckLimits.maxCopiesFor(card.getRarity());
            if (entry.getValue() > limit) {
                return DeckValidationResult.error(DeckErrorKind.DUPLICATE_LIMIT,
                    String.format("%s card %s appears %d times (max: %d)",
                        card.getRarity().getId(), card.getId(), entry.getValue(), limit));
            }
        }
        return DeckValidationResult.ok();
    }

    @Override
    public String getRuleName() {
        return "DuplicateLimit";
    }
}
