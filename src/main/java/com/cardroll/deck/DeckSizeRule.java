package com.cardroll.deck;

import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Rule that keeps the deck size within {@code [1, maxDeckSize]}.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DeckSizeRule implements DeckRule {

    private final DeckLimits deckLimits;

    @Override
    public DeckValidationResult evaluate(Deck deck, Set<String> ownedCardIds) {
        int size = deck.getSize();
        if (size < 1 || size > deckLimits.getMaxDeckSize()) {
            return DeckValidationResult.error(DeckErrorKind.DECK_SIZE,
                String.format("Deck must hold between 1 and %d cards, has %d",
                    deckLimits.getMaxDeckSize(), size));
        }
        return DeckValidationResult.ok();
    }

    @Override
    public String getRuleName() {
        return "DeckSize";
    }
}
