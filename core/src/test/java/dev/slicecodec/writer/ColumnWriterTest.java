/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import dev.slicecodec.TypeCases;
import dev.slicecodec.TypeCases.Case;
import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.metadata.ColumnFileInfo;
import dev.slicecodec.metadata.ColumnType;
import dev.slicecodec.metadata.Compression;
import dev.slicecodec.value.RejectedValueException;
import dev.slicecodec.value.RejectedValueException.Reason;

import static dev.slicecodec.TypeCases.bytes;
import static dev.slicecodec.TypeCases.fileName;
import static dev.slicecodec.TypeCases.readBack;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnWriterTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @MethodSource("dev.slicecodec.TypeCases#all")
    void testRejectsBadValuesAndRoundTrips(Case c) throws Exception {
        for (boolean noneSupport : new boolean[]{ false, true }) {
            Path file = tempDir.resolve(fileName(c.type(), noneSupport));
            WriterOptions options = WriterOptions.builder()
                    .compression(Compression.GZIP)
                    .noneSupport(noneSupport)
                    .build();

            try (ColumnWriter<?> writer = ColumnWriter.open(file, c.type(), options)) {
                assertThat(writer.compression()).isEqualTo(Compression.GZIP);
                long count = 0;
                for (int ix = 0; ix < c.inputs().size(); ix++) {
                    Object value = c.inputs().get(ix);
                    if (ix < c.badCount() || (value == null && !noneSupport)) {
                        assertThatThrownBy(() -> writer.write(value))
                                .as("%s should reject %s", c.type(), value)
                                .isInstanceOf(RejectedValueException.class);
                    }
                    else {
                        assertThat(writer.write(value)).as("%s should accept %s", c.type(), value).isTrue();
                        count++;
                    }
                }
                assertThat(writer.count()).isEqualTo(count);
                if (c.hasMinMax()) {
                    assertThat((Object) writer.min()).isEqualTo(c.min());
                    assertThat((Object) writer.max()).isEqualTo(c.max());
                }
                else {
                    assertThat((Object) writer.min()).isNull();
                    assertThat((Object) writer.max()).isNull();
                }
            }

            if (noneSupport) {
                assertThat(readBack(file, c.type())).containsExactlyElementsOf(c.expected());
            }
        }
    }

    @ParameterizedTest
    @MethodSource("dev.slicecodec.TypeCases#all")
    void testDefaultsAreValidatedAndSubstituted(Case c) throws Exception {
        List<Object> inputs = c.inputs();
        for (int ix = 0; ix < inputs.size(); ix++) {
            Path file = tempDir.resolve(fileName(c.type(), "default-" + ix));
            WriterOptions options = WriterOptions.builder()
                    .noneSupport(true)
                    .defaultValue(inputs.get(ix))
                    .build();

            if (ix < c.badCount()) {
                assertThatThrownBy(() -> ColumnWriter.open(file, c.type(), options))
                        .isInstanceOf(RejectedValueException.class);
                continue;
            }

            try (ColumnWriter<?> writer = ColumnWriter.open(file, c.type(), options)) {
                for (Object value : inputs) {
                    assertThat(writer.write(value)).isTrue();
                }
                assertThat(writer.count()).isEqualTo(inputs.size());
            }

            List<Object> expected = new ArrayList<>(Collections.nCopies(c.badCount(), c.expected().get(ix - c.badCount())));
            expected.addAll(c.expected());
            assertThat(readBack(file, c.type())).containsExactlyElementsOf(expected);
        }
    }

    @Test
    void testDefaultReplacesNoneWithoutNoneSupport() throws Exception {
        Path file = tempDir.resolve("col");
        WriterOptions options = WriterOptions.builder().defaultValue(7).build();

        try (ColumnWriter<Long> writer = ColumnWriter.open(file, ColumnType.INT64, options)) {
            writer.write(null);
            writer.write(3);
            writer.write("three");
            ColumnFileInfo<Long> info = writer.finish();

            assertThat(info.count()).isEqualTo(3);
            assertThat(info.min()).isEqualTo(3L);
            assertThat(info.max()).isEqualTo(7L);
            assertThat(info.noneSupport()).isFalse();
        }

        assertThat(readBack(file, ColumnType.INT64)).containsExactly(7L, 3L, 7L);
    }

    @Test
    void testNoneDefaultRequiresNoneSupport() {
        WriterOptions options = WriterOptions.builder().defaultValue(null).build();

        assertThatThrownBy(() -> ColumnWriter.open(tempDir.resolve("col"), ColumnType.INT32, options))
                .isInstanceOf(IllegalArgumentException.class)
                .isNotInstanceOf(RejectedValueException.class);
        assertThat(tempDir).isEmptyDirectory();
    }

    @Test
    void testNoneIsRejectedWithReason() throws Exception {
        try (ColumnWriter<String> writer = ColumnWriter.open(tempDir.resolve("col"), ColumnType.UNICODE)) {
            assertThatThrownBy(() -> writer.write(null))
                    .isInstanceOfSatisfying(RejectedValueException.class,
                            e -> assertThat(e.getReason()).isEqualTo(Reason.NONE_NOT_SUPPORTED));
            assertThat(writer.count()).isZero();
        }
    }

    @Test
    void testEmptyAndNoneStringValues() throws Exception {
        Map<ColumnType<?>, Object> empties = Map.of(
                ColumnType.BYTES, bytes(""),
                ColumnType.ASCII, "",
                ColumnType.UNICODE, "");

        for (Map.Entry<ColumnType<?>, Object> entry : empties.entrySet()) {
            ColumnType<?> type = entry.getKey();
            Path empty = tempDir.resolve(fileName(type, "empty"));
            try (ColumnWriter<?> writer = ColumnWriter.open(empty, type)) {
                writer.write(entry.getValue());
                writer.write(entry.getValue());
            }
            assertThat(readBack(empty, type)).containsExactly(entry.getValue(), entry.getValue());

            Path nones = tempDir.resolve(fileName(type, "none"));
            try (ColumnWriter<?> writer = ColumnWriter.open(nones, type, WriterOptions.builder().noneSupport(true).build())) {
                writer.write(null);
                writer.write(null);
            }
            assertThat(readBack(nones, type)).containsExactly(null, null);
        }
    }

    @Test
    void testEmptyColumn() throws Exception {
        Path file = tempDir.resolve("col");
        ColumnFileInfo<Double> info;
        try (ColumnWriter<Double> writer = ColumnWriter.open(file, ColumnType.FLOAT64)) {
            info = writer.finish();
        }

        assertThat(info.count()).isZero();
        assertThat(info.min()).isNull();
        assertThat(info.max()).isNull();
        assertThat(readBack(file, ColumnType.FLOAT64)).isEmpty();
    }

    @Test
    void testNaNIsStoredButNotOrdered() throws Exception {
        Path file = tempDir.resolve("col");
        try (ColumnWriter<Double> writer = ColumnWriter.open(file, ColumnType.FLOAT64)) {
            writer.write(Double.NaN);
            writer.write(1.5);
            writer.write(Double.longBitsToDouble(0x7ff8000000000123L));
            writer.write(-2.0);

            assertThat(writer.min()).isEqualTo(-2.0);
            assertThat(writer.max()).isEqualTo(1.5);
        }

        assertThat(readBack(file, ColumnType.FLOAT64)).containsExactly(Double.NaN, 1.5, Double.NaN, -2.0);
    }

    @Test
    void testOnlyNaNLeavesMinMaxUnset() throws Exception {
        try (ColumnWriter<Number> writer = ColumnWriter.open(tempDir.resolve("col"), ColumnType.NUMBER)) {
            writer.write(Double.NaN);
            ColumnFileInfo<Number> info = writer.finish();

            assertThat(info.count()).isEqualTo(1);
            assertThat(info.min()).isNull();
            assertThat(info.max()).isNull();
        }
    }

    @Test
    void testFileAppearsOnlyAfterFinish() throws Exception {
        Path file = tempDir.resolve("col");
        try (ColumnWriter<Integer> writer = ColumnWriter.open(file, ColumnType.INT32)) {
            writer.write(1);

            assertThat(file).doesNotExist();
            assertThat(tempDir.resolve(".col.tmp")).exists();

            ColumnFileInfo<Integer> first = writer.finish();
            assertThat(writer.finish()).isSameAs(first);
            assertThat(file).exists();
            assertThat(tempDir.resolve(".col.tmp")).doesNotExist();

            assertThatThrownBy(() -> writer.write(2)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void testMissingDirectory() {
        assertThatThrownBy(() -> ColumnWriter.open(tempDir.resolve("DOES/NOT/EXIST"), ColumnType.INT64))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testFailedWriterRemovesTemporaryFile() throws Exception {
        Path dir = Files.createDirectory(tempDir.resolve("sub"));
        Path file = dir.resolve("col");
        ColumnWriter<Long> writer = ColumnWriter.open(file, ColumnType.INT64);
        writer.write(42L);

        // pull the directory out from under the writer
        Files.delete(dir.resolve(".col.tmp"));
        Files.delete(dir);

        assertThatThrownBy(writer::finish).isInstanceOf(IOException.class);
        assertThat(file).doesNotExist();
        assertThatThrownBy(() -> writer.write(1L)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(writer::finish).isInstanceOf(IllegalStateException.class);
        writer.close();
    }

    @Test
    void testHashcheckAgreesWithWrite() throws Exception {
        WriterOptions options = WriterOptions.builder()
                .noneSupport(true)
                .hashFilter(new HashFilter(1, 3, true))
                .build();
        try (ColumnWriter<String> writer = ColumnWriter.open(tempDir.resolve("col"), ColumnType.UNICODE, options)) {
            for (int i = 0; i < 200; i++) {
                String value = i % 10 == 0 ? null : "value-" + i;
                boolean wouldWrite = writer.hashcheck(value);
                assertThat(writer.write(value)).isEqualTo(wouldWrite);
            }
            assertThatThrownBy(() -> writer.hashcheck(42)).isInstanceOf(RejectedValueException.class);
        }
    }

    @Test
    void testOptionsFromMap() throws Exception {
        Map<String, Object> map = new HashMap<>();
        map.put("compression", "zstd");
        map.put("none_support", true);
        map.put("default", null);
        map.put("hashfilter", List.of(2, 4, true));

        WriterOptions options = WriterOptions.fromMap(map);

        assertThat(options.compression()).isEqualTo(Compression.ZSTD);
        assertThat(options.noneSupport()).isTrue();
        assertThat(options.hasDefault()).isTrue();
        assertThat(options.defaultValue()).isNull();
        assertThat(options.hashFilter()).isEqualTo(new HashFilter(2, 4, true));
    }

    @Test
    void testOptionsFromMapRejectsUnknownKeysAndBadValues() {
        assertThatThrownBy(() -> WriterOptions.fromMap(Map.of("nonexistent_keyword", "test")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonexistent_keyword");
        assertThatThrownBy(() -> WriterOptions.fromMap(Map.of("none_support", "yes")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WriterOptions.fromMap(Map.of("hashfilter", List.of(1))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WriterOptions.fromMap(Map.of("hashfilter", List.of(3, 3))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WriterOptions.fromMap(Map.of("compression", "rar")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
