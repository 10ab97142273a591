package com.cardroll.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * DTO carrying a deck as an ordered list of card ids.
 */
@Data
public class DeckRequest {

    @NotNull(message = "Card ids are required")
    private List<@NotBlank(message = "Card ids must not be blank") String> cardIds;
}
