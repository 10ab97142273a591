package com.cardroll.deck;

import java.util.Set;

/**
 * A deck composition constraint.
 *
 * Rules are pure: they only look at the deck, the owned card ids and immutable catalog data.
 */
public interface DeckRule {

    /**
     * Evaluate the rule against a deck.
     *
     * @param deck the candidate deck
     * @param ownedCardIds ids of the cards in the player's collection
     * @return the result of the rule evaluation
     */
    DeckValidationResult evaluate(Deck deck, Set<String> ownedCardIds);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
