package com.cardroll.deck;

import com.cardroll.common.exception.ValidationException;

/**
 * Thrown when a deck is rejected while replacing a player's active deck.
 */
public class DeckValidationException extends ValidationException {

    private final DeckErrorKind errorKind;

    public DeckValidationException(DeckValidationResult result) {
        super("Invalid deck: " + result.getReason());
        this.errorKind = result.getErrorKind();
    }

    public DeckErrorKind getErrorKind() {
        return errorKind;
    }
}
