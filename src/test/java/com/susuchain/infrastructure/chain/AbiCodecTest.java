package com.susuchain.infrastructure.chain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbiCodecTest {

    @Test
    void encodeCall_appendsPaddedArguments() {
        String data = AbiCodec.encodeCall(SusuGroupAbi.SET_AUTOMATION_EXECUTOR,
                AbiCodec.encodeAddress("0x2A6C106ae13B558BB9E2Ec64Bd2f1f7BEFF3A5E0"));

        assertEquals("0x093f4772" + "000000000000000000000000" + "2a6c106ae13b558bb9e2ec64bd2f1f7beff3a5e0", data);
    }

    @Test
    void encodeCall_noArguments_isSelectorOnly() {
        assertEquals("0xebd0cbf8", AbiCodec.encodeCall(SusuGroupAbi.CAN_EXECUTE_PAYOUT));
    }

    @Test
    void encodeUint_leftPadsToWord() {
        byte[] word = AbiCodec.encodeUint(BigInteger.valueOf(5));

        assertEquals(32, word.length);
        assertEquals(5, word[31]);
        assertEquals(BigInteger.valueOf(5), AbiCodec.decodeUint(word, 0));
    }

    @Test
    void encodeUint_negative_rejected() {
        assertThrows(AbiDecodingException.class, () -> AbiCodec.encodeUint(BigInteger.valueOf(-1)));
    }

    @Test
    void decodeBoolAndBytes_fromPayoutEligibility() {
        byte[] data = AbiCodec.fromHex(word("1") + word("40") + word("2") + "abcd" + "0".repeat(60));

        assertTrue(AbiCodec.decodeBool(data, 0));
        assertArrayEquals(new byte[]{(byte) 0xab, (byte) 0xcd}, AbiCodec.decodeBytes(data, 1));
    }

    @Test
    void decodeBool_valueOtherThanZeroOrOne_rejected() {
        byte[] data = AbiCodec.fromHex(word("2"));

        assertThrows(AbiDecodingException.class, () -> AbiCodec.decodeBool(data, 0));
    }

    @Test
    void decodeString() {
        // "Family"
        byte[] data = AbiCodec.fromHex(word("20") + word("6") + "46616d696c79" + "0".repeat(52));

        assertEquals("Family", AbiCodec.decodeString(data, 0));
    }

    @Test
    void decodeAddressArray() {
        byte[] data = AbiCodec.fromHex(word("20") + word("2")
                + word("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa")
                + word("bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"));

        assertEquals(List.of("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"),
                AbiCodec.decodeAddressArray(data, 0));
    }

    @Test
    void decode_truncatedReturnData_rejected() {
        byte[] data = AbiCodec.fromHex("0x0001");

        assertThrows(AbiDecodingException.class, () -> AbiCodec.decodeUint(data, 0));
    }

    @Test
    void decodeBytes_lengthOverrunningData_rejected() {
        byte[] data = AbiCodec.fromHex(word("1") + word("40") + word("ff"));

        assertThrows(AbiDecodingException.class, () -> AbiCodec.decodeBytes(data, 1));
    }

    @Test
    void fromHex_malformed_rejected() {
        assertThrows(AbiDecodingException.class, () -> AbiCodec.fromHex("0xzz"));
    }

    static String word(String hex) {
        return "0".repeat(64 - hex.length()) + hex;
    }
}
