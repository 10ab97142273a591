package com.cardroll.deck;

import com.cardroll.catalog.CardCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Rule that only lets a player deck cards they have rolled.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class CardOwnershipRule implements DeckRule {

    private final CardCatalog cardCatalog;

    @Override
    public DeckValidationResult evaluate(Deck deck, Set<String> ownedCardIds) {
        for (String cardId : deck.getCardIds()) {
            if (!cardCatalog.contains(cardId)) {
                return DeckValidationResult.error(DeckErrorKind.UNOWNED_CARD, "Unknown card: " + cardId);
            }
            if (!ownedCardIds.contains(cardId)) {
                return DeckValidationResult.error(DeckErrorKind.UNOWNED_CARD,
                    "Card is not in the player's collection: " + cardId);
            }
        }
        return DeckValidationResult.ok();
    }

    @Override
    public String getRuleName() {
        return "CardOwnership";
    }
}
