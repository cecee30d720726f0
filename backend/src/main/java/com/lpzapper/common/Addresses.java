package com.lpzapper.common;

import org.web3j.crypto.Keys;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address helpers. The canonical form used as ledger identity is the EIP-55 checksummed address.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    /**
     * Checksummed form of {@code address}. Throws IllegalArgumentException for anything that is not 0x + 40 hex.
     */
    public static String checksum(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid EVM address: " + address);
        }
        return Keys.toChecksumAddress(address.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }

    public static boolean isZero(String address) {
        return address == null || ZERO_ADDRESS.equalsIgnoreCase(address.trim());
    }
}
