package com.susuchain.infrastructure.chain;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.ChainReadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JsonRpcSusuFactoryClient implements SusuFactoryReader {

    private final JsonRpcClient rpcClient;
    private final AutomationProperties properties;

    @Override
    public List<String> getRecentGroups(int count) {
        return read(AbiCodec.encodeCall(SusuFactoryAbi.GET_RECENT_GROUPS,
                AbiCodec.encodeUint(BigInteger.valueOf(count))), SusuFactoryAbi.GET_RECENT_GROUPS);
    }

    @Override
    public List<String> getAllGroups() {
        return read(AbiCodec.encodeCall(SusuFactoryAbi.GET_ALL_GROUPS), SusuFactoryAbi.GET_ALL_GROUPS);
    }

    private List<String> read(String callData, ContractFunction function) {
        String factory = properties.getChain().getFactoryAddress();
        if (factory == null || factory.isBlank()) {
            throw new ChainReadException("No factory address configured (app.chain.factory-address)",
                    null, function.getSignature());
        }
        try {
            return AbiCodec.decodeAddressArray(AbiCodec.fromHex(rpcClient.ethCall(factory, callData)), 0);
        } catch (RuntimeException e) {
            throw new ChainReadException(function.getName() + " failed on factory " + factory + ": "
                    + e.getMessage(), factory, function.getSignature(), e);
        }
    }
}
