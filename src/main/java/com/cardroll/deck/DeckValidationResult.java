package com.cardroll.deck;

import lombok.Value;

/**
 * Result of a deck validation.
 */
@Value
public class DeckValidationResult {
    boolean valid;
    DeckErrorKind errorKind;
    String reason;

    public static DeckValidationResult ok() {
        return new DeckValidationResult(true, null, null);
    }

    public static DeckValidationResult error(DeckErrorKind kind, String reason) {
        return new DeckValidationResult(false, kind, reason);
    }
}
