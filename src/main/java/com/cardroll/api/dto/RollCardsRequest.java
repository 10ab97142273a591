package com.cardroll.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for rolling cards from a pack.
 */
@Data
public class RollCardsRequest {

    @NotBlank(message = "Pack type is required")
    private String packType = "basic";

    @NotNull(message = "Count is required")
    private Integer count = 1;
}
