package com.kakeibo.ledger.exception;

/**
 * Thrown when user input fails a precondition of a ledger mutation.
 * Raised before any state changes, so the ledger is left untouched.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
