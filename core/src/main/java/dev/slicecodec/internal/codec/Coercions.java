/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.math.BigDecimal;
import java.math.BigInteger;

import dev.slicecodec.value.RejectedValueException;

/**
 * Input conversions shared by the numeric codecs.
 */
final class Coercions {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Coercions() {
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    /**
     * Integral input as a long.
     *
     * @throws RejectedValueException with {@code OUT_OF_RANGE} for a BigInteger beyond 64 bits,
     *         {@code WRONG_TYPE} for anything not integral
     */
    static long toLong(String typeName, Object value) {
        if (value instanceof BigInteger big) {
            if (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0) {
                throw RejectedValueException.outOfRange(typeName, value);
            }
            return big.longValue();
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        throw RejectedValueException.wrongType(typeName, value);
    }

    /**
     * Truncate a finite float toward zero, as parsed integer types do.
     */
    static BigInteger truncate(String typeName, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw RejectedValueException.outOfRange(typeName, value);
        }
        return new BigDecimal(value).toBigInteger();
    }

    static double toDouble(String typeName, Object value) {
        if (value instanceof Number && (isIntegral(value) || isFloating(value)
                || value instanceof BigDecimal)) {
            return ((Number) value).doubleValue();
        }
        throw RejectedValueException.wrongType(typeName, value);
    }

    static double canonicalNaN(double value) {
        return Double.isNaN(value) ? Double.NaN : value;
    }
}
