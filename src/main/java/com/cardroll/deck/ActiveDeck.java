package com.cardroll.deck;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The deck a player currently plays with. Only ever replaced by a validated deck.
 */
@Entity
@Table(name = "active_decks")
@Data
@NoArgsConstructor
public class ActiveDeck {

    @Id
    @Column(name = "player_id")
    private String playerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "active_deck_cards", joinColumns = @JoinColumn(name = "player_id"))
    @OrderColumn(name = "position")
    @Column(name = "card_id", nullable = false)
    private List<String> cardIds = new ArrayList<>();

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ActiveDeck(String playerId) {
        this.playerId = playerId;
    }

    public void replaceWith(Deck deck) {
        this.cardIds.clear();
        this.cardIds.addAll(deck.getCardIds());
        this.updatedAt = Instant.now();
    }
}
