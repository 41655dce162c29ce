package com.sharedmodel.core.math;

import com.sharedmodel.core.error.ArithmeticViolationException;
import com.sharedmodel.core.error.ErrorReason;

import java.math.BigInteger;

/**
 * Unsigned 256-bit checked arithmetic and an exact integer square root.
 *
 * All escrow amounts are non-negative and bounded by {@link #MAX_UINT256}. Any operation whose
 * true result falls outside {@code [0, MAX_UINT256]} fails instead of wrapping.
 */
public final class UintMath {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private UintMath() {}

    /**
     * Floor square root using Newton iteration over integers.
     * sqrt(0) = 0, sqrt(1) = 1, sqrt(15) = 3, sqrt(16) = 4.
     */
    public static long sqrt(long x) {
        if (x < 0) {
            throw new ArithmeticViolationException(ErrorReason.NEGATIVE_AMOUNT,
                    "Square root of negative value: " + x);
        }
        // ceil(x / 2) without the overflow of (x + 1) / 2 at Long.MAX_VALUE
        long z = (x >>> 1) + (x & 1L);
        long y = x;
        while (z < y) {
            y = z;
            z = (x / z + z) >>> 1;
        }
        return y;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checkRange(requireUint(a).add(requireUint(b)));
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger result = requireUint(a).subtract(requireUint(b));
        if (result.signum() < 0) {
            throw new ArithmeticViolationException(ErrorReason.UNDERFLOW,
                    "Subtraction underflow: " + a + " - " + b);
        }
        return result;
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return checkRange(requireUint(a).multiply(requireUint(b)));
    }

    /**
     * Truncating division.
     */
    public static BigInteger div(BigInteger a, BigInteger b) {
        if (requireUint(b).signum() == 0) {
            throw new ArithmeticViolationException(ErrorReason.DIVISION_BY_ZERO, "Division by zero");
        }
        return requireUint(a).divide(b);
    }

    /**
     * Rejects null, negative and oversized values.
     */
    public static BigInteger requireUint(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (value.signum() < 0) {
            throw new ArithmeticViolationException(ErrorReason.NEGATIVE_AMOUNT,
                    "Amount must not be negative: " + value);
        }
        return checkRange(value);
    }

    private static BigInteger checkRange(BigInteger value) {
        if (value.compareTo(MAX_UINT256) > 0) {
            throw new ArithmeticViolationException(ErrorReason.OVERFLOW,
                    "Value exceeds uint256: " + value);
        }
        return value;
    }
}
