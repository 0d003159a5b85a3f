/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalPackingTest {

    @Test
    void testPackedValuesAreNonNegative() {
        FoldedDateTime latest = new FoldedDateTime(LocalDateTime.of(9999, 12, 31, 23, 59, 59, 999999000), true);
        assertThat(TemporalPacking.packDateTime(latest)).isPositive();
        assertThat(TemporalPacking.packTime(FoldedTime.of(23, 59, 59, 999999, true))).isPositive();
        assertThat(TemporalPacking.packDate(LocalDate.of(9999, 12, 31))).isPositive();
    }

    @Test
    void testUnpackInvertsPack() {
        FoldedDateTime dateTime = new FoldedDateTime(LocalDateTime.of(1, 1, 1, 0, 0, 0, 1000), true);
        assertThat(TemporalPacking.unpackDateTime(TemporalPacking.packDateTime(dateTime))).isEqualTo(dateTime);

        FoldedTime time = FoldedTime.of(2, 42, 0, 3, true);
        assertThat(TemporalPacking.unpackTime(TemporalPacking.packTime(time))).isEqualTo(time);

        LocalDate date = LocalDate.of(1985, 7, 10);
        assertThat(TemporalPacking.unpackDate(TemporalPacking.packDate(date))).isEqualTo(date);
    }

    @Test
    void testPackingPreservesOrder() {
        FoldedTime earlier = FoldedTime.of(2, 42, 0, 3, true);
        FoldedTime later = FoldedTime.of(2, 42, 0, 4, false);
        assertThat(TemporalPacking.packTime(earlier)).isLessThan(TemporalPacking.packTime(later));
        assertThat(TemporalPacking.packDate(LocalDate.of(2000, 1, 31)))
                .isLessThan(TemporalPacking.packDate(LocalDate.of(2000, 2, 1)));
    }

    @Test
    void testWithoutFold() {
        long folded = TemporalPacking.packTime(FoldedTime.of(1, 30, 0, 0, true));
        long unfolded = TemporalPacking.packTime(FoldedTime.of(1, 30, 0, 0, false));
        assertThat(folded).isNotEqualTo(unfolded);
        assertThat(TemporalPacking.withoutFold(folded)).isEqualTo(unfolded);
    }

    @Test
    void testSubMicrosecondPrecisionIsDropped() {
        FoldedDateTime dateTime = FoldedDateTime.of(LocalDateTime.of(2020, 5, 5, 5, 5, 5, 123456789));
        assertThat(dateTime.dateTime().getNano()).isEqualTo(123456000);
        assertThat(TemporalPacking.unpackDateTime(TemporalPacking.packDateTime(dateTime))).isEqualTo(dateTime);
    }
}
