/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompressionTest {

    @Test
    void testFromName() {
        assertThat(Compression.fromName("gzip")).isEqualTo(Compression.GZIP);
        assertThat(Compression.fromName(" ZSTD ")).isEqualTo(Compression.ZSTD);
        assertThat(Compression.fromName("none")).isEqualTo(Compression.NONE);
        assertThatThrownBy(() -> Compression.fromName("brotli"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("brotli");
    }

    @Test
    void testIdsAreStable() {
        for (Compression compression : Compression.values()) {
            assertThat(Compression.fromId(compression.getId())).isSameAs(compression);
        }
        assertThat(Compression.LZ4.getId()).isEqualTo(4);
        assertThatThrownBy(() -> Compression.fromId(42)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDefaultCompression() {
        String previous = System.getProperty(Compression.DEFAULT_COMPRESSION_PROPERTY);
        try {
            System.clearProperty(Compression.DEFAULT_COMPRESSION_PROPERTY);
            assertThat(Compression.defaultCompression()).isEqualTo(Compression.GZIP);

            System.setProperty(Compression.DEFAULT_COMPRESSION_PROPERTY, "lz4");
            assertThat(Compression.defaultCompression()).isEqualTo(Compression.LZ4);

            System.setProperty(Compression.DEFAULT_COMPRESSION_PROPERTY, "rar");
            assertThatThrownBy(Compression::defaultCompression).isInstanceOf(IllegalArgumentException.class);
        }
        finally {
            if (previous == null) {
                System.clearProperty(Compression.DEFAULT_COMPRESSION_PROPERTY);
            }
            else {
                System.setProperty(Compression.DEFAULT_COMPRESSION_PROPERTY, previous);
            }
        }
    }
}
