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
import java.time.LocalDateTime;
import java.time.LocalTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.slicecodec.metadata.ColumnType;
import dev.slicecodec.value.Complex;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;
import dev.slicecodec.value.RejectedValueException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashValueTest {

    @Test
    void testFalsyValuesHashToZero() {
        assertThat(HashValue.hash(null)).isZero();
        assertThat(HashValue.hash("")).isZero();
        assertThat(HashValue.hash(new byte[0])).isZero();
        assertThat(HashValue.hash(0)).isZero();
        assertThat(HashValue.hash(0L)).isZero();
        assertThat(HashValue.hash(BigInteger.ZERO)).isZero();
        assertThat(HashValue.hash(0.0)).isZero();
        assertThat(HashValue.hash(-0.0)).isZero();
        assertThat(HashValue.hash(0.0f)).isZero();
        assertThat(HashValue.hash(false)).isZero();
        assertThat(HashValue.hash(Complex.ZERO)).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "a", "0", "foo", "a slightly longer string", "\0", "a\0b" })
    void testStringTypesHashAlike(String value) {
        long unicode = ColumnType.UNICODE.hash(value);
        assertThat(ColumnType.ASCII.hash(value)).isEqualTo(unicode);
        assertThat(ColumnType.BYTES.hash(value.getBytes(StandardCharsets.UTF_8))).isEqualTo(unicode);
        assertThat(HashValue.hash(value)).isEqualTo(unicode);
    }

    @Test
    void testTextAndBytesDiffer() {
        byte[] latin1 = { (byte) 0xe4 };
        assertThat(HashValue.hash(latin1)).isNotEqualTo(HashValue.hash("ä"));
        assertThat(ColumnType.BYTES.hash(latin1)).isNotEqualTo(ColumnType.UNICODE.hash("ä"));
    }

    @Test
    void testAsciiHashRejectsNonAscii() {
        assertThatThrownBy(() -> ColumnType.ASCII.hash(new byte[]{ (byte) 0xe4 }))
                .isInstanceOf(RejectedValueException.class);
        assertThatThrownBy(() -> ColumnType.ASCII.hash("ä"))
                .isInstanceOf(RejectedValueException.class);
    }

    @ParameterizedTest
    @ValueSource(longs = { 0, 1, 2, 9007199254740991L, -42 })
    void testNumericTypesHashAlike(long value) {
        long expected = ColumnType.INT64.hash(value);
        assertThat(ColumnType.FLOAT64.hash((double) value)).isEqualTo(expected);
        assertThat(ColumnType.NUMBER.hash(value)).isEqualTo(expected);
        assertThat(ColumnType.NUMBER.hash((double) value)).isEqualTo(expected);
        assertThat(HashValue.hash(BigInteger.valueOf(value))).isEqualTo(expected);
        assertThat(HashValue.hash(BigDecimal.valueOf(value).setScale(2))).isEqualTo(expected);
        assertThat(HashValue.hash(Complex.ofReal(value))).isEqualTo(expected);
        if (value == (int) value) {
            assertThat(ColumnType.INT32.hash((int) value)).isEqualTo(expected);
        }
    }

    @Test
    void testIntegralDoublesBeyondLongRangeHashLikeBigIntegers() {
        assertHashAlike(0x1p63, BigInteger.TWO.pow(63));
        assertHashAlike(0x1p64, BigInteger.TWO.pow(64));
        assertHashAlike(1e20, BigInteger.TEN.pow(20));
        assertHashAlike(-0x1p70, BigInteger.TWO.pow(70).negate());
        assertHashAlike(-0x1p63, BigInteger.valueOf(Long.MIN_VALUE));
    }

    private static void assertHashAlike(double value, BigInteger integer) {
        long expected = HashValue.hash(integer);
        assertThat(HashValue.hash(value)).as("%s", value).isEqualTo(expected);
        assertThat(ColumnType.NUMBER.hash(value)).isEqualTo(expected);
        assertThat(ColumnType.NUMBER.hash(integer)).isEqualTo(expected);
        assertThat(ColumnType.FLOAT64.hash(value)).isEqualTo(expected);
        assertThat(HashValue.hash(Complex.ofReal(value))).isEqualTo(expected);
        assertThat(HashValue.hash(new BigDecimal(integer).setScale(3))).isEqualTo(expected);
    }

    @Test
    void testInfinitiesHashAsDoubles() {
        assertThat(HashValue.hash(Double.POSITIVE_INFINITY))
                .isNotEqualTo(HashValue.hash(Double.NEGATIVE_INFINITY))
                .isNotZero();
        assertThat(ColumnType.NUMBER.hash(Double.POSITIVE_INFINITY)).isEqualTo(HashValue.hash(Double.POSITIVE_INFINITY));
    }

    @Test
    void testTrueHashesLikeOne() {
        assertThat(HashValue.hash(true)).isEqualTo(HashValue.hash(1L));
        assertThat(ColumnType.BOOL.hash(true)).isEqualTo(HashValue.hash(1));
    }

    @Test
    void testFloat32HashesRoundedValue() {
        assertThat(ColumnType.FLOAT32.hash(1.1)).isEqualTo(HashValue.hash((double) 1.1f));
        assertThat(ColumnType.FLOAT32.hash(1.1)).isNotEqualTo(HashValue.hash(1.1));
    }

    @Test
    void testAllNaNsHashAlike() {
        double otherNaN = Double.longBitsToDouble(0x7ff8000000000abcL);
        assertThat(HashValue.hash(otherNaN)).isEqualTo(HashValue.hash(Double.NaN));
        assertThat(HashValue.hash(Float.NaN)).isEqualTo(HashValue.hash(Double.NaN));
        assertThat(HashValue.hash(Double.NaN)).isNotZero();
    }

    @Test
    void testNonIntegralAndLargeNumbers() {
        assertThat(HashValue.hash(0.5)).isNotEqualTo(HashValue.hash(0L)).isNotZero();
        assertThat(HashValue.hash(0x1p63)).isNotEqualTo(HashValue.hash(Long.MIN_VALUE));
        BigInteger big = BigInteger.TWO.pow(100);
        assertThat(HashValue.hash(big)).isEqualTo(ColumnType.NUMBER.hash(big)).isNotZero();
        assertThat(HashValue.hash(big)).isNotEqualTo(HashValue.hash(big.negate()));
    }

    @Test
    void testComplexWithImaginaryPart() {
        assertThat(HashValue.hash(new Complex(1, 2))).isNotEqualTo(HashValue.hash(new Complex(2, 1)));
        assertThat(HashValue.hash(new Complex(0, 1))).isNotZero();
        assertThat(HashValue.hash(new Complex(-0.0, 1))).isEqualTo(HashValue.hash(new Complex(0.0, 1)));
        assertThat(HashValue.hash(new Complex(1, -0.0))).isEqualTo(HashValue.hash(1L));
    }

    @Test
    void testFoldDoesNotChangeHash() {
        FoldedTime time = FoldedTime.of(2, 30, 0, 0, false);
        assertThat(HashValue.hash(FoldedTime.of(2, 30, 0, 0, true))).isEqualTo(HashValue.hash(time));
        assertThat(HashValue.hash(LocalTime.of(2, 30))).isEqualTo(HashValue.hash(time));

        LocalDateTime dateTime = LocalDateTime.of(2021, 10, 31, 2, 30);
        assertThat(HashValue.hash(new FoldedDateTime(dateTime, true))).isEqualTo(HashValue.hash(dateTime));
        assertThat(HashValue.hash(dateTime)).isNotEqualTo(HashValue.hash(dateTime.plusNanos(1000)));
    }

    @Test
    void testHashesAreStable() {
        // the key is fixed, so these never change between runs
        assertThat(HashValue.hash(1L)).isEqualTo(HashValue.hashLong(1L));
        assertThat(HashValue.hash("foo")).isEqualTo(HashValue.hash("foo".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testUnsupportedType() {
        assertThatThrownBy(() -> HashValue.hash(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
