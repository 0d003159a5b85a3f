/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.config;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.metadata.Compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptionValuesTest {

    @Test
    void testUnknownKey() {
        OptionValues.checkKnownKeys(Map.of("a", 1), Set.of("a", "b"));
        assertThatThrownBy(() -> OptionValues.checkKnownKeys(Map.of("c", 1), Set.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'c'");
    }

    @Test
    void testIntegers() {
        assertThat(OptionValues.asLong("n", 5)).isEqualTo(5L);
        assertThat(OptionValues.asLong("n", BigInteger.valueOf(-3))).isEqualTo(-3L);
        assertThat(OptionValues.asInt("n", 12L)).isEqualTo(12);
        assertThatThrownBy(() -> OptionValues.asLong("n", 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OptionValues.asLong("n", "5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OptionValues.asInt("n", 1L << 40))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void testBoolean() {
        assertThat(OptionValues.asBoolean("flag", true)).isTrue();
        assertThatThrownBy(() -> OptionValues.asBoolean("flag", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("flag");
    }

    @Test
    void testCompression() {
        assertThat(OptionValues.asCompression("compression", null)).isNull();
        assertThat(OptionValues.asCompression("compression", "snappy")).isEqualTo(Compression.SNAPPY);
        assertThat(OptionValues.asCompression("compression", Compression.NONE)).isEqualTo(Compression.NONE);
        assertThatThrownBy(() -> OptionValues.asCompression("compression", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHashFilter() {
        assertThat(OptionValues.asHashFilter("hashfilter", null)).isNull();
        assertThat(OptionValues.asHashFilter("hashfilter", List.of(1, 3))).isEqualTo(HashFilter.of(1, 3));
        assertThat(OptionValues.asHashFilter("hashfilter", List.of(2, 3, true)))
                .isEqualTo(new HashFilter(2, 3, true));
        assertThatThrownBy(() -> OptionValues.asHashFilter("hashfilter", List.of(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OptionValues.asHashFilter("hashfilter", Arrays.asList(3, 3)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
