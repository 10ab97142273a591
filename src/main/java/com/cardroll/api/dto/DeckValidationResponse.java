package com.cardroll.api.dto;

import com.cardroll.deck.DeckErrorKind;
import com.cardroll.deck.DeckValidationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a deck validation request. {@code error} and {@code message} are only set
 * for an invalid deck.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeckValidationResponse {

    private boolean valid;
    private DeckErrorKind error;
    private String message;

    public static DeckValidationResponse from(DeckValidationResult result) {
        return new DeckValidationResponse(result.isValid(), result.getErrorKind(), result.getReason());
    }
}
