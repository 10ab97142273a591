package com.cardroll.deck;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for active decks, keyed by player id.
 */
@Repository
public interface ActiveDeckRepository extends JpaRepository<ActiveDeck, String> {
}
