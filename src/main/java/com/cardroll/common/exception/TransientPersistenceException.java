package com.cardroll.common.exception;

/**
 * Thrown when the pity store is unavailable or does not answer in time.
 */
public class TransientPersistenceException extends CardRollException {

    private final String playerId;
    private final String operation;

    public TransientPersistenceException(String message, String playerId, String operation, Throwable cause) {
        super(message, cause);
        this.playerId = playerId;
        this.operation = operation;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getOperation() {
        return operation;
    }
}
