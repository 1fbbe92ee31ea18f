package com.susuchain.domain.exception;

/**
 * Exception thrown when the automation network cannot answer a read
 * (active duties, duty state, balance).
 */
public class QueryException extends RuntimeException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
