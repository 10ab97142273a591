package com.cardroll.pity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for pity counter persistence.
 */
@Repository
public interface PityCounterRepository extends JpaRepository<PityCounter, String> {

    List<PityCounter> findByPlayerId(String playerId);
}
