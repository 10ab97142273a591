package com.cardroll.pack;

import com.cardroll.catalog.Card;
import com.cardroll.catalog.CardType;
import lombok.Value;

import java.util.Set;

/**
 * Restricts which catalog cards a pack type can hand out.
 * An empty set means "no restriction" for that criterion.
 */
@Value
public class CardPoolFilter {

    Set<CardType> allowedTypes;
    Set<String> requiredTags;

    public static CardPoolFilter any() {
        return new CardPoolFilter(Set.of(), Set.of());
    }

    public static CardPoolFilter of(Set<CardType> allowedTypes, Set<String> requiredTags) {
        return new CardPoolFilter(Set.copyOf(allowedTypes), Set.copyOf(requiredTags));
    }

    public boolean matches(Card card) {
        if (!allowedTypes.isEmpty() && !allowedTypes.contains(card.getType())) {
            return false;
        }
        return requiredTags.isEmpty() || card.hasAnyTag(requiredTags);
    }
}
