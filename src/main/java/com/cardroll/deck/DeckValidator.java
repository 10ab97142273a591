package com.cardroll.deck;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Validates a candidate deck against every configured deck rule.
 *
 * Rules are evaluated in order (size, ownership, duplicate limits) and the first
 * failing rule decides the result. Validation has no side effects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckValidator {

    private final List<DeckRule> rules;

    /**
     * Validate a deck against a player's collection.
     *
     * @param deck the candidate deck
     * @param ownedCardIds ids of the cards the player owns
     * @return ok, or the first violated constraint
     */
    public DeckValidationResult validate(Deck deck, Set<String> ownedCardIds) {
        log.debug("Evaluating {} deck rules for a deck of {} cards", rules.size(), deck.getSize());

        for (DeckRule rule : rules) {
            DeckValidationResult result = rule.evaluate(deck, ownedCardIds);

            if (!result.isValid()) {
                log.debug("Deck rule {} rejected deck: {}", rule.getRuleName(), result.getReason());
                return result;
            }
        }

        return DeckValidationResult.ok();
    }
}
