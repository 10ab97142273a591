package com.cardroll.common.exception;

/**
 * Base exception for all card roll engine exceptions.
 */
public class CardRollException extends RuntimeException {

    public CardRollException(String message) {
        super(message);
    }

    public CardRollException(String message, Throwable cause) {
        super(message, cause);
    }
}
