package com.talentledger.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Lossless conversion between smallest-unit integers (wei) and ether display strings.
 */
public final class AmountFormat {

    public static final int DECIMALS = 18;

    private AmountFormat() {
    }

    /** 1500000000000000000 -> "1.5"; zero -> "0". */
    public static String toEther(BigInteger wei) {
        if (wei == null) {
            return "0";
        }
        return toEther(new BigDecimal(wei));
    }

    public static String toEther(BigDecimal wei) {
        if (wei == null || wei.signum() == 0) {
            return "0";
        }
        return wei.movePointLeft(DECIMALS).stripTrailingZeros().toPlainString();
    }

    /**
     * "1.5" -> 1500000000000000000.
     *
     * @throws IllegalArgumentException when the value has more than 18 fractional digits or is not a number
     */
    public static BigInteger parseEther(String ether) {
        if (ether == null || ether.isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(ether.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount: " + ether, e);
        }
        BigDecimal wei = value.movePointRight(DECIMALS);
        try {
            return wei.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount has more than " + DECIMALS + " decimals: " + ether, e);
        }
    }

    /** Decimal string of a wei amount, as stored in activity payloads. */
    public static String toWeiString(BigInteger wei) {
        return wei == null ? null : wei.toString();
    }

    public static BigInteger fromWeiString(String wei) {
        return wei == null || wei.isBlank() ? BigInteger.ZERO : new BigInteger(wei.trim());
    }
}
