package com.kakeibo.ledger.exception;

/**
 * Thrown when a ledger collection cannot be written to durable storage.
 * The in-memory ledger keeps its last committed state when this propagates.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
