package com.cardroll.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Card categories.
 */
public enum CardType {
    CREATURE,
    SPELL,
    ARTIFACT;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CardType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(id.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonCreator
    static CardType fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown card type: " + id));
    }
}
