package com.susuchain.domain.model;

import java.util.regex.Pattern;

public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    public static boolean isZero(String address) {
        return address == null || ZERO_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * Address equality ignoring EIP-55 checksum casing.
     */
    public static boolean same(String a, String b) {
        return a != null && a.equalsIgnoreCase(b);
    }
}
