package com.cardroll.common.exception;

/**
 * Thrown when a card is not found in the catalog.
 */
public class CardNotFoundException extends CardRollException {

    public CardNotFoundException(String cardId) {
        super("Card not found: " + cardId);
    }
}
