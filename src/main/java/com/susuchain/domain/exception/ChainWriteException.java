package com.susuchain.domain.exception;

/**
 * Exception thrown when a transaction cannot be sent, is not mined in time, or reverts.
 */
public class ChainWriteException extends RuntimeException {

    private final String contractAddress;
    private final String function;
    private final String transactionHash;

    public ChainWriteException(String message, String contractAddress, String function, String transactionHash) {
        super(message);
        this.contractAddress = contractAddress;
        this.function = function;
        this.transactionHash = transactionHash;
    }

    public ChainWriteException(String message, String contractAddress, String function, Throwable cause) {
        super(message, cause);
        this.contractAddress = contractAddress;
        this.function = function;
        this.transactionHash = null;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public String getFunction() {
        return function;
    }

    public String getTransactionHash() {
        return transactionHash;
    }
}
