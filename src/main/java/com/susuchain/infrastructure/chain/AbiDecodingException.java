package com.susuchain.infrastructure.chain;

/**
 * Return data or an argument does not match the expected ABI layout.
 */
public class AbiDecodingException extends RuntimeException {

    public AbiDecodingException(String message) {
        super(message);
    }

    public AbiDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
