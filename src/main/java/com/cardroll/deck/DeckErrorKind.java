package com.cardroll.deck;

/**
 * Reasons a deck can be rejected, in the order they are checked.
 */
public enum DeckErrorKind {
    /**
     * Deck is empty or larger than the maximum deck size.
     */
    DECK_SIZE,

    /**
     * Deck holds a card that is not in the player's collection.
     */
    UNOWNED_CARD,

    /**
     * Deck holds more copies of a card than its rarity allows.
     */
    DUPLICATE_LIMIT
}
