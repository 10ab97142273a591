package com.cardroll.collection;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A card in a player's collection, with the number of copies rolled so far.
 */
@Entity
@Table(name = "owned_cards",
    uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "card_id"}))
@Data
@NoArgsConstructor
public class OwnedCard {

    @Id
    private String id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "card_id", nullable = false)
    private String cardId;

    private int quantity;

    @Column(name = "first_acquired_at")
    private Instant firstAcquiredAt;

    @Column(name = "last_acquired_at")
    private Instant lastAcquiredAt;

    public OwnedCard(String playerId, String cardId) {
        this.id = UUID.randomUUID().toString();
        this.playerId = playerId;
        this.cardId = cardId;
        this.quantity = 0;
        this.firstAcquiredAt = Instant.now();
        this.lastAcquiredAt = this.firstAcquiredAt;
    }

    public void addCopies(int copies) {
        this.quantity += copies;
        this.lastAcquiredAt = Instant.now();
    }
}
