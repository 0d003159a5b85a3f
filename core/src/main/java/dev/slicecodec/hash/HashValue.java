/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.hash;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import dev.slicecodec.internal.codec.TemporalPacking;
import dev.slicecodec.value.Complex;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;

/**
 * The canonical 64-bit hash used to assign values to slices.
 * <p>
 * Hashes are SipHash-2-4 with a fixed key over a canonical byte form of the value, so they are stable
 * across runs and identical on the write and read paths. The result is an unsigned 64-bit quantity
 * held in a {@code long}.
 * </p>
 * <ul>
 *   <li>Falsy values ({@code null}, empty strings and byte arrays, zero, {@code false}) hash to 0.</li>
 *   <li>Numerically equal values hash equally regardless of type: {@code 5}, {@code 5L}, {@code 5.0f},
 *   {@code 5.0}, {@code BigInteger.valueOf(5)} and {@code new Complex(5, 0)} all agree.</li>
 *   <li>Text hashes as its UTF-8 bytes, byte strings as themselves.</li>
 * </ul>
 */
public final class HashValue {

    private static final HashFunction SIPHASH = Hashing.sipHash24(0x0706050403020100L, 0x0f0e0d0c0b0a0908L);

    private static final long CANONICAL_NAN_BITS = 0x7ff8000000000000L;
    private static final double TWO_POW_63 = 0x1p63;
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private HashValue() {
    }

    /**
     * Hash any supported value.
     *
     * @throws IllegalArgumentException if the value's type has no canonical hash
     */
    public static long hash(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return hashLong(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return hashDouble(((Number) value).doubleValue());
        }
        if (value instanceof BigInteger big) {
            return hashBigInteger(big);
        }
        if (value instanceof BigDecimal decimal) {
            return hashBigDecimal(decimal);
        }
        if (value instanceof Boolean bool) {
            return hashBoolean(bool);
        }
        if (value instanceof Complex complex) {
            return hashComplex(complex.real(), complex.imag());
        }
        if (value instanceof byte[] bytes) {
            return hashBytes(bytes);
        }
        if (value instanceof String text) {
            return hashText(text);
        }
        if (value instanceof LocalDate date) {
            return hashDate(date);
        }
        if (value instanceof FoldedTime time) {
            return hashTime(time);
        }
        if (value instanceof LocalTime localTime) {
            return hashTime(FoldedTime.of(localTime));
        }
        if (value instanceof FoldedDateTime dateTime) {
            return hashDateTime(dateTime);
        }
        if (value instanceof LocalDateTime localDateTime) {
            return hashDateTime(FoldedDateTime.of(localDateTime));
        }
        throw new IllegalArgumentException("No canonical hash for values of type " + value.getClass().getName());
    }

    public static long hashLong(long value) {
        if (value == 0) {
            return 0;
        }
        return SIPHASH.hashLong(value).asLong();
    }

    public static long hashBoolean(boolean value) {
        return value ? hashLong(1) : 0;
    }

    /**
     * Integral doubles hash like the equal integer, whatever their magnitude; every NaN hashes like the
     * canonical NaN.
     */
    public static long hashDouble(double value) {
        if (value == 0.0) {
            return 0;
        }
        if (Double.isNaN(value)) {
            return SIPHASH.hashLong(CANONICAL_NAN_BITS).asLong();
        }
        if (!Double.isInfinite(value) && value == Math.rint(value)) {
            if (value >= -TWO_POW_63 && value < TWO_POW_63) {
                return hashLong((long) value);
            }
            return hashBigInteger(new BigDecimal(value).toBigInteger());
        }
        return SIPHASH.hashLong(Double.doubleToLongBits(value)).asLong();
    }

    public static long hashBigInteger(BigInteger value) {
        if (value.bitLength() < 64) {
            return hashLong(value.longValue());
        }
        // minimal two's complement, little-endian
        byte[] bigEndian = value.toByteArray();
        byte[] littleEndian = new byte[bigEndian.length];
        for (int i = 0; i < bigEndian.length; i++) {
            littleEndian[i] = bigEndian[bigEndian.length - 1 - i];
        }
        return SIPHASH.hashBytes(littleEndian).asLong();
    }

    public static long hashBigDecimal(BigDecimal value) {
        if (value.signum() == 0) {
            return 0;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            BigInteger integer = stripped.toBigInteger();
            if (integer.compareTo(LONG_MIN) >= 0 && integer.compareTo(LONG_MAX) <= 0) {
                return hashLong(integer.longValue());
            }
            return hashBigInteger(integer);
        }
        return hashDouble(value.doubleValue());
    }

    /**
     * Complex values with a zero imaginary part hash like their real part.
     */
    public static long hashComplex(double real, double imag) {
        if (imag == 0.0) {
            return hashDouble(real);
        }
        // -0.0 and 0.0 are the same component
        return SIPHASH.newHasher(16)
                .putLong(Double.doubleToLongBits(real + 0.0))
                .putLong(Double.doubleToLongBits(imag + 0.0))
                .hash()
                .asLong();
    }

    public static long hashBytes(byte[] value) {
        if (value.length == 0) {
            return 0;
        }
        return SIPHASH.hashBytes(value).asLong();
    }

    public static long hashText(String value) {
        if (value.isEmpty()) {
            return 0;
        }
        return SIPHASH.hashBytes(value.getBytes(StandardCharsets.UTF_8)).asLong();
    }

    public static long hashDate(LocalDate value) {
        return SIPHASH.hashInt(TemporalPacking.packDate(value)).asLong();
    }

    public static long hashTime(FoldedTime value) {
        return SIPHASH.hashLong(TemporalPacking.withoutFold(TemporalPacking.packTime(value))).asLong();
    }

    public static long hashDateTime(FoldedDateTime value) {
        return SIPHASH.hashLong(TemporalPacking.withoutFold(TemporalPacking.packDateTime(value))).asLong();
    }
}
