package com.cardroll.catalog;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a card entry in the catalog resource.
 */
@Data
public class CardDefinition {

    private String id;
    private String name;
    private String description;
    private String emoji;
    private Rarity rarity;
    private CardType type;
    private int cost;
    private int attack;
    private int defense;
    private int health;
    private List<String> effects = new ArrayList<>();
    private List<String> tags = new ArrayList<>();

    public Card toCard() {
        return Card.builder()
            .id(id)
            .name(name)
            .description(description)
            .emoji(emoji)
            .rarity(rarity)
            .type(type)
            .cost(cost)
            .attack(attack)
            .defense(defense)
            .health(health)
            .effects(effects == null ? List.of() : effects)
            .tags(tags == null ? List.of() : tags)
            .build();
    }
}
