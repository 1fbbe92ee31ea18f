package com.susuchain.infrastructure.chain;

import com.susuchain.config.AutomationProperties;
import com.susuchain.domain.exception.ChainReadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.susuchain.infrastructure.chain.AbiCodecTest.word;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JsonRpcSusuFactoryClientTest {

    private static final String FACTORY = "0xfafafafafafafafafafafafafafafafafafafafa";

    @Mock private JsonRpcClient rpcClient;

    private AutomationProperties properties;
    private JsonRpcSusuFactoryClient client;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        properties.getChain().setFactoryAddress(FACTORY);
        client = new JsonRpcSusuFactoryClient(rpcClient, properties);
    }

    @Test
    void getRecentGroups_encodesCountAndDecodesAddresses() {
        when(rpcClient.ethCall(FACTORY, "0x6a517028" + word("5")))
                .thenReturn("0x" + word("20") + word("1") + word("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"));

        assertEquals(List.of("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"), client.getRecentGroups(5));
    }

    @Test
    void getAllGroups_emptyFactory() {
        when(rpcClient.ethCall(FACTORY, "0x21cd3cae")).thenReturn("0x" + word("20") + word("0"));

        assertTrue(client.getAllGroups().isEmpty());
    }

    @Test
    void noFactoryConfigured_throwsWithoutCalling() {
        properties.getChain().setFactoryAddress("");

        assertThrows(ChainReadException.class, () -> client.getAllGroups());
        verifyNoInteractions(rpcClient);
    }
}
