package com.cardroll.pity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted pity counter row: one per player and pack type.
 */
@Entity
@Table(name = "pity_counters",
    uniqueConstraints = @UniqueConstraint(columnNames = {"player_id", "pack_type_name"}))
@Data
@NoArgsConstructor
public class PityCounter {

    @Id
    private String id;

    @Column(name = "player_id", nullable = false)
    private String playerId;

    @Column(name = "pack_type_name", nullable = false)
    private String packTypeName;

    private int counter;

    private int threshold;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PityCounter(String playerId, String packTypeName, PityState state) {
        this.id = UUID.randomUUID().toString();
        this.playerId = playerId;
        this.packTypeName = packTypeName;
        apply(state);
    }

    public void apply(PityState state) {
        this.counter = state.getCounter();
        this.threshold = state.getThreshold();
        this.updatedAt = Instant.now();
    }

    public PityState toState() {
        return PityState.of(counter, threshold);
    }
}
