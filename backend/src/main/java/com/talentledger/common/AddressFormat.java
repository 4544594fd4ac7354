package com.talentledger.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address validity and canonical (lower-case) form. Party channels, profile ids and activity records
 * always carry the canonical form.
 */
public final class AddressFormat {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private AddressFormat() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * @throws IllegalArgumentException when the address is not a 20-byte hex address
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    /** Normalizes, or returns null for null input. */
    public static String normalizeNullable(String address) {
        return address == null ? null : normalize(address);
    }
}
