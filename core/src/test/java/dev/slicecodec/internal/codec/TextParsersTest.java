/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.slicecodec.value.Complex;
import dev.slicecodec.value.RejectedValueException;
import dev.slicecodec.value.RejectedValueException.Reason;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextParsersTest {

    @Test
    void testIntegers() {
        assertThat(TextParsers.parseInteger("t", "42")).isEqualTo(BigInteger.valueOf(42));
        assertThat(TextParsers.parseInteger("t", "+7")).isEqualTo(BigInteger.valueOf(7));
        assertThat(TextParsers.parseInteger("t", "-0")).isEqualTo(BigInteger.ZERO);
        assertThat(TextParsers.parseInteger("t", "123456789012345678901234567890"))
                .isEqualTo(new BigInteger("123456789012345678901234567890"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "0.1", "1e3", "0x10", "1 2", "--1", "+" })
    void testInvalidIntegers(String text) {
        assertThatThrownBy(() -> TextParsers.parseInteger("t", text))
                .isInstanceOfSatisfying(RejectedValueException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.UNPARSEABLE));
    }

    @Test
    void testFloats() {
        assertThat(TextParsers.parseFloat("t", "4.2")).isEqualTo(4.2);
        assertThat(TextParsers.parseFloat("t", ".5")).isEqualTo(0.5);
        assertThat(TextParsers.parseFloat("t", "5.")).isEqualTo(5.0);
        assertThat(TextParsers.parseFloat("t", "-1E-3")).isEqualTo(-0.001);
        assertThat(TextParsers.parseFloat("t", "inf")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(TextParsers.parseFloat("t", "-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(TextParsers.parseFloat("t", "NaN")).isNaN();
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "1 thing", "1d", "0x1p3", "e5", ".", "infinit" })
    void testInvalidFloats(String text) {
        assertThatThrownBy(() -> TextParsers.parseFloat("t", text)).isInstanceOf(RejectedValueException.class);
    }

    @Test
    void testNumbers() {
        assertThat(TextParsers.parseNumber("t", "12")).isEqualTo(12L);
        assertThat(TextParsers.parseNumber("t", "9223372036854775809")).isEqualTo(new BigInteger("9223372036854775809"));
        assertThat(TextParsers.parseNumber("t", "1e25")).isEqualTo(1e25);
        assertThat(TextParsers.parseNumber("t", "0.0")).isEqualTo(0.0);
        assertThatThrownBy(() -> TextParsers.parseNumber("t", "")).isInstanceOf(RejectedValueException.class);
    }

    @Test
    void testComplex() {
        assertThat(TextParsers.parseComplex("t", "1.5")).isEqualTo(Complex.ofReal(1.5));
        assertThat(TextParsers.parseComplex("t", "2j")).isEqualTo(new Complex(0, 2));
        assertThat(TextParsers.parseComplex("t", "j")).isEqualTo(new Complex(0, 1));
        assertThat(TextParsers.parseComplex("t", "1+2j")).isEqualTo(new Complex(1, 2));
        assertThat(TextParsers.parseComplex("t", "1-j")).isEqualTo(new Complex(1, -1));
        assertThat(TextParsers.parseComplex("t", "(1e3-2.5J)")).isEqualTo(new Complex(1000, -2.5));
        assertThat(TextParsers.parseComplex("t", "inf+nanj").imag()).isNaN();
        assertThatThrownBy(() -> TextParsers.parseComplex("t", "1+2")).isInstanceOf(RejectedValueException.class);
        assertThatThrownBy(() -> TextParsers.parseComplex("t", "j1")).isInstanceOf(RejectedValueException.class);
    }

    @Test
    void testTemporal() {
        assertThat(TextParsers.parseDate("t", "2024-02-29")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(TextParsers.parseTime("t", "13:14:15.000016")).isEqualTo(LocalTime.of(13, 14, 15, 16000));
        assertThat(TextParsers.parseDateTime("t", "2024-02-29 13:14")).isEqualTo(LocalDateTime.of(2024, 2, 29, 13, 14));
        assertThat(TextParsers.parseDateTime("t", "2024-02-29T13:14")).isEqualTo(LocalDateTime.of(2024, 2, 29, 13, 14));
        assertThatThrownBy(() -> TextParsers.parseDate("t", "2023-02-29")).isInstanceOf(RejectedValueException.class);
        assertThatThrownBy(() -> TextParsers.parseDateTime("t", "2024-02-29")).isInstanceOf(RejectedValueException.class);
    }
}
