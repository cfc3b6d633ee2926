package com.vrfradar.common;

import java.math.BigInteger;
import java.util.Locale;

/**
 * JSON-RPC hex quantity helpers ("0x1a" ⇄ 26).
 */
public final class HexQuantity {

    private HexQuantity() {
    }

    public static String toHex(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("quantity must be >= 0: " + value);
        }
        return "0x" + Long.toHexString(value);
    }

    /**
     * @throws NumberFormatException if the value is null, lacks the 0x prefix or is not hex
     */
    public static long parseLong(String hex) {
        return parseBigInteger(hex).longValueExact();
    }

    public static BigInteger parseBigInteger(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new NumberFormatException("invalid hex quantity: " + hex);
        }
        return new BigInteger(hex.substring(2), 16);
    }

    public static boolean isHex(String value) {
        if (value == null || !value.startsWith("0x")) {
            return false;
        }
        for (int i = 2; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /** Lower-cases; blank becomes null. */
    public static String normalize(String hex) {
        return hex == null || hex.isBlank() ? null : hex.toLowerCase(Locale.ROOT);
    }
}
