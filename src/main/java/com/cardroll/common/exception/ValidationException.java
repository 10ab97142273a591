package com.cardroll.common.exception;

/**
 * Thrown when caller-supplied input violates a documented constraint.
 * Recoverable by the caller adjusting its input; never retried automatically.
 */
public class ValidationException extends CardRollException {

    public ValidationException(String message) {
        super(message);
    }
}
