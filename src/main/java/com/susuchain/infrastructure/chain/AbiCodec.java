package com.susuchain.infrastructure.chain;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Solidity ABI encoding for the handful of types the Susu contracts expose.
 *
 * Decoding works on the raw return data of an eth_call. Word indexes refer to
 * 32-byte slots in the head of the return tuple; dynamic values (bytes, string,
 * arrays) are reached through the offset stored in their head slot.
 */
public final class AbiCodec {

    private static final int WORD = 32;
    private static final HexFormat HEX = HexFormat.of();

    private AbiCodec() {
    }

    public static String encodeCall(ContractFunction function, byte[]... arguments) {
        StringBuilder data = new StringBuilder(function.getSelector());
        for (byte[] argument : arguments) {
            data.append(HEX.formatHex(argument));
        }
        return data.toString();
    }

    public static byte[] encodeAddress(String address) {
        byte[] raw = fromHex(address);
        if (raw.length != 20) {
            throw new AbiDecodingException("Address must be 20 bytes: " + address);
        }
        byte[] word = new byte[WORD];
        System.arraycopy(raw, 0, word, WORD - 20, 20);
        return word;
    }

    public static byte[] encodeUint(BigInteger value) {
        if (value.signum() < 0) {
            throw new AbiDecodingException("uint256 cannot be negative: " + value);
        }
        byte[] raw = value.toByteArray();
        int start = raw.length > WORD ? raw.length - WORD : 0;
        int length = raw.length - start;
        if (length > WORD || (start > 0 && raw[0] != 0)) {
            throw new AbiDecodingException("Value exceeds uint256: " + value);
        }
        byte[] word = new byte[WORD];
        System.arraycopy(raw, start, word, WORD - length, length);
        return word;
    }

    public static boolean decodeBool(byte[] data, int wordIndex) {
        BigInteger value = decodeUint(data, wordIndex);
        if (value.equals(BigInteger.ZERO)) {
            return false;
        }
        if (value.equals(BigInteger.ONE)) {
            return true;
        }
        throw new AbiDecodingException("Invalid bool value in word " + wordIndex + ": " + value);
    }

    public static BigInteger decodeUint(byte[] data, int wordIndex) {
        return new BigInteger(1, word(data, wordIndex * WORD));
    }

    public static String decodeAddress(byte[] data, int wordIndex) {
        byte[] word = word(data, wordIndex * WORD);
        return toHex(Arrays.copyOfRange(word, WORD - 20, WORD));
    }

    public static byte[] decodeBytes(byte[] data, int wordIndex) {
        int offset = toOffset(decodeUint(data, wordIndex), data);
        int length = toOffset(new BigInteger(1, word(data, offset)), data);
        int start = offset + WORD;
        if (start + length > data.length) {
            throw new AbiDecodingException("Dynamic value of " + length + " bytes overruns return data of "
                    + data.length + " bytes");
        }
        return Arrays.copyOfRange(data, start, start + length);
    }

    public static String decodeString(byte[] data, int wordIndex) {
        return new String(decodeBytes(data, wordIndex), StandardCharsets.UTF_8);
    }

    public static List<String> decodeAddressArray(byte[] data, int wordIndex) {
        int offset = toOffset(decodeUint(data, wordIndex), data);
        int length = toOffset(new BigInteger(1, word(data, offset)), data);
        List<String> addresses = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            byte[] element = word(data, offset + WORD + i * WORD);
            addresses.add(toHex(Arrays.copyOfRange(element, WORD - 20, WORD)));
        }
        return addresses;
    }

    public static String toHex(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new AbiDecodingException("Hex value is null");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return HEX.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new AbiDecodingException("Malformed hex value: " + hex, e);
        }
    }

    private static byte[] word(byte[] data, int byteOffset) {
        if (byteOffset < 0 || byteOffset + WORD > data.length) {
            throw new AbiDecodingException("Return data too short: need " + (byteOffset + WORD)
                    + " bytes, got " + data.length);
        }
        return Arrays.copyOfRange(data, byteOffset, byteOffset + WORD);
    }

    private static int toOffset(BigInteger value, byte[] data) {
        if (value.compareTo(BigInteger.valueOf(data.length)) > 0) {
            throw new AbiDecodingException("Offset or length " + value + " exceeds return data of "
                    + data.length + " bytes");
        }
        return value.intValueExact();
    }
}
