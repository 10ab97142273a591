package com.cardroll.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A player's active deck with its aggregate numbers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActiveDeckResponse {

    private List<String> cardIds;
    private int size;
    private int totalCost;
}
