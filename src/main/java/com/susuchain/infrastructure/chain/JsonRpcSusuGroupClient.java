package com.susuchain.infrastructure.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.ChainReadException;
import com.susuchain.domain.exception.ChainWriteException;
import com.susuchain.domain.model.GroupInfo;
import com.susuchain.domain.model.PayoutEligibility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * SusuGroup contract access through {@link JsonRpcClient}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonRpcSusuGroupClient implements SusuGroupReader, SusuGroupWriter {

    private final JsonRpcClient rpcClient;
    private final AutomationProperties properties;

    @Override
    public boolean isGroupActive(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.GROUP_ACTIVE, data -> AbiCodec.decodeBool(data, 0));
    }

    @Override
    public BigInteger getCurrentRound(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.CURRENT_ROUND, data -> AbiCodec.decodeUint(data, 0));
    }

    @Override
    public BigInteger getRoundDeadline(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.ROUND_DEADLINE, data -> AbiCodec.decodeUint(data, 0));
    }

    @Override
    public BigInteger getTimeUntilDeadline(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.GET_TIME_UNTIL_DEADLINE, data -> AbiCodec.decodeUint(data, 0));
    }

    @Override
    public PayoutEligibility canExecutePayout(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.CAN_EXECUTE_PAYOUT, data -> new PayoutEligibility(
                AbiCodec.decodeBool(data, 0),
                AbiCodec.decodeBytes(data, 1)));
    }

    @Override
    public String getAutomationExecutor(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.AUTOMATION_EXECUTOR, data -> AbiCodec.decodeAddress(data, 0));
    }

    @Override
    public GroupInfo getGroupInfo(String groupAddress) {
        return read(groupAddress, SusuGroupAbi.GET_GROUP_INFO, data -> GroupInfo.builder()
                .name(AbiCodec.decodeString(data, 0))
                .ensName(AbiCodec.decodeString(data, 1))
                .contributionAmount(AbiCodec.decodeUint(data, 2))
                .contributionInterval(AbiCodec.decodeUint(data, 3))
                .maxMembers(AbiCodec.decodeUint(data, 4))
                .currentMembers(AbiCodec.decodeUint(data, 5))
                .currentRound(AbiCodec.decodeUint(data, 6))
                .active(AbiCodec.decodeBool(data, 7))
                .currentBeneficiary(AbiCodec.decodeAddress(data, 8))
                .build());
    }

    @Override
    public String setAutomationExecutor(String groupAddress, String executorAddress) {
        ContractFunction function = SusuGroupAbi.SET_AUTOMATION_EXECUTOR;
        String sender = properties.getChain().getSenderAddress();
        if (sender == null || sender.isBlank()) {
            throw new ChainWriteException("No sender address configured (app.chain.sender-address)",
                    groupAddress, function.getSignature(), (String) null);
        }

        String transactionHash;
        try {
            transactionHash = rpcClient.sendTransaction(sender, groupAddress,
                    AbiCodec.encodeCall(function, AbiCodec.encodeAddress(executorAddress)));
        } catch (RuntimeException e) {
            throw new ChainWriteException(function.getName() + " could not be sent to " + groupAddress
                    + ": " + e.getMessage(), groupAddress, function.getSignature(), e);
        }

        log.info("Sent {} for group {}: tx={}", function.getName(), groupAddress, transactionHash);

        JsonNode receipt = awaitReceipt(groupAddress, function, transactionHash);
        String status = receipt.path("status").asText();
        if (!"0x1".equals(status)) {
            throw new ChainWriteException(function.getName() + " reverted for " + groupAddress
                    + " (status=" + status + ")", groupAddress, function.getSignature(), transactionHash);
        }
        return transactionHash;
    }

    private JsonNode awaitReceipt(String groupAddress, ContractFunction function, String transactionHash) {
        Duration pollInterval = properties.getChain().getReceiptPollInterval();
        Instant giveUpAt = Instant.now().plus(properties.getChain().getReceiptTimeout());

        while (true) {
            Optional<JsonNode> receipt;
            try {
                receipt = rpcClient.getTransactionReceipt(transactionHash);
            } catch (RuntimeException e) {
                throw new ChainWriteException("Receipt lookup failed for " + transactionHash + ": "
                        + e.getMessage(), groupAddress, function.getSignature(), e);
            }
            if (receipt.isPresent()) {
                return receipt.get();
            }
            if (Instant.now().isAfter(giveUpAt)) {
                throw new ChainWriteException("Transaction not mined within "
                        + properties.getChain().getReceiptTimeout(), groupAddress, function.getSignature(),
                        transactionHash);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChainWriteException("Interrupted waiting for " + transactionHash, groupAddress,
                        function.getSignature(), e);
            }
        }
    }

    private <T> T read(String groupAddress, ContractFunction function, Function<byte[], T> decoder) {
        try {
            String result = rpcClient.ethCall(groupAddress, AbiCodec.encodeCall(function));
            return decoder.apply(AbiCodec.fromHex(result));
        } catch (RuntimeException e) {
            throw new ChainReadException(function.getName() + " failed for " + groupAddress + ": "
                    + e.getMessage(), groupAddress, function.getSignature(), e);
        }
    }
}
