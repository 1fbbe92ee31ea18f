package com.susuchain.domain.exception;

/**
 * Exception thrown when a contract read fails.
 *
 * Common causes:
 * - RPC endpoint unavailable or timing out
 * - Call reverted
 * - Response that does not decode against the expected ABI
 *
 * The payout checker never lets this escape; it becomes a negative check result.
 */
public class ChainReadException extends RuntimeException {

    private final String contractAddress;
    private final String function;

    public ChainReadException(String message, String contractAddress, String function) {
        super(message);
        this.contractAddress = contractAddress;
        this.function = function;
    }

    public ChainReadException(String message, String contractAddress, String function, Throwable cause) {
        super(message, cause);
        this.contractAddress = contractAddress;
        this.function = function;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public String getFunction() {
        return function;
    }
}
