package com.cardroll.deck;

import com.cardroll.common.exception.ValidationException;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate deck: an ordered list of catalog card ids, duplicates allowed.
 */
@Value
public class Deck {

    List<String> cardIds;

    /**
     * @throws ValidationException if an id is null or blank
     */
    public static Deck of(List<String> cardIds) {
        if (cardIds == null) {
            return new Deck(List.of());
        }
        for (String cardId : cardIds) {
            if (cardId == null || cardId.isBlank()) {
                throw new ValidationException("Deck contains a blank card id");
            }
        }
        return new Deck(List.copyOf(cardIds));
    }

    public int getSize() {
        return cardIds.size();
    }

    /**
     * Copies per card id, in order of first appearance.
     */
    public Map<String, Integer> copiesPerCard() {
        Map<String, Integer> copies = new LinkedHashMap<>();
        cardIds.forEach(id -> copies.merge(id, 1, Integer::sum));
        return copies;
    }
}
