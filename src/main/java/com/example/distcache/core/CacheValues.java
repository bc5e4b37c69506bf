package com.example.distcache.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Value semantics for counters and compare-and-swap.
 */
public final class CacheValues {

    private CacheValues() {
    }

    /**
     * Equality used by compare-and-swap. Integral numbers compare by numeric value so that a
     * counter stored as {@code Long} matches an {@code Integer} expectation.
     */
    public static boolean sameValue(Object current, Object expected) {
        if (isIntegral(current) && isIntegral(expected)) {
            return ((Number) current).longValue() == ((Number) expected).longValue();
        }
        return Objects.equals(current, expected);
    }

    /** Reads a stored value as a counter. */
    public static long asCounter(String key, Object value) {
        if (isIntegral(value)) {
            if (value instanceof BigInteger && ((BigInteger) value).bitLength() > 63) {
                throw new CacheValidationException("value at '" + key + "' is out of range for a counter");
            }
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new CacheValidationException("value at '" + key + "' is not an integer", e);
            }
        }
        throw new CacheValidationException("value at '" + key + "' is not an integer: " + value.getClass().getName());
    }

    public static long addExact(String key, long current, long delta) {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new CacheValidationException("increment of '" + key + "' would overflow", e);
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }
}
