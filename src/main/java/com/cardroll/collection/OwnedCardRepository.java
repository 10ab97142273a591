package com.cardroll.collection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for player collections.
 */
@Repository
public interface OwnedCardRepository extends JpaRepository<OwnedCard, String> {

    List<OwnedCard> findByPlayerId(String playerId);

    Optional<OwnedCard> findByPlayerIdAndCardId(String playerId, String cardId);
}
