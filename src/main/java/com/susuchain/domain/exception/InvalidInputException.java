package com.susuchain.domain.exception;

/**
 * Thrown when a caller supplies a missing or malformed group address or duty id.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
