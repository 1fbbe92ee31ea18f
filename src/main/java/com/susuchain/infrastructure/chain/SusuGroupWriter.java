package com.susuchain.infrastructure.chain;

/**
 * Writes against a SusuGroup contract. executeScheduledPayout() is deliberately
 * absent: only the automation network's dedicated caller invokes it.
 */
public interface SusuGroupWriter {

    /**
     * Sends setAutomationExecutor(executor) and waits for it to be mined.
     *
     * @return transaction hash of the successful transaction
     * @throws com.susuchain.domain.exception.ChainWriteException if the transaction fails, reverts or times out
     */
    String setAutomationExecutor(String groupAddress, String executorAddress);
}
