/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.benchmarks;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.metadata.ColumnFileInfo;
import dev.slicecodec.metadata.ColumnType;
import dev.slicecodec.metadata.Compression;
import dev.slicecodec.reader.ColumnReader;
import dev.slicecodec.reader.ReaderOptions;
import dev.slicecodec.writer.ColumnWriter;
import dev.slicecodec.writer.WriterOptions;

/**
 * Write and read throughput of int64 and unicode columns for each compression scheme.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ColumnRoundTripBenchmark {

    @Param({ "none", "gzip", "snappy", "zstd", "lz4" })
    private String compression;

    @Param("1000000")
    private int size;

    private Path dir;
    private long[] longs;
    private String[] strings;
    private Path longFile;
    private Path stringFile;

    @Setup
    public void setup() throws IOException {
        dir = Files.createTempDirectory("slicecodec-bench");
        Random random = new Random(42);
        longs = new long[size];
        strings = new String[size];
        for (int i = 0; i < size; i++) {
            longs[i] = random.nextInt(1_000_000);
            strings[i] = "value-" + random.nextInt(10_000);
        }

        longFile = dir.resolve("int64.col");
        stringFile = dir.resolve("unicode.col");
        writeLongs(longFile, null);
        writeStrings(stringFile);
    }

    @TearDown
    public void tearDown() throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : files.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(file);
            }
        }
    }

    @Benchmark
    public ColumnFileInfo<Long> writeInt64() throws IOException {
        return writeLongs(dir.resolve("write-int64.col"), null);
    }

    @Benchmark
    public ColumnFileInfo<Long> writeInt64Slice() throws IOException {
        return writeLongs(dir.resolve("write-int64-slice.col"), HashFilter.of(0, 16));
    }

    @Benchmark
    public ColumnFileInfo<String> writeUnicode() throws IOException {
        return writeStrings(dir.resolve("write-unicode.col"));
    }

    @Benchmark
    public void readInt64(Blackhole blackhole) throws IOException {
        read(longFile, ColumnType.INT64, blackhole);
    }

    @Benchmark
    public void readUnicode(Blackhole blackhole) throws IOException {
        read(stringFile, ColumnType.UNICODE, blackhole);
    }

    private ColumnFileInfo<Long> writeLongs(Path path, HashFilter hashFilter) throws IOException {
        WriterOptions options = WriterOptions.builder()
                .compression(Compression.fromName(compression))
                .hashFilter(hashFilter)
                .build();
        try (ColumnWriter<Long> writer = ColumnWriter.open(path, ColumnType.INT64, options)) {
            for (long value : longs) {
                writer.write(value);
            }
            return writer.finish();
        }
    }

    private ColumnFileInfo<String> writeStrings(Path path) throws IOException {
        WriterOptions options = WriterOptions.builder()
                .compression(Compression.fromName(compression))
                .build();
        try (ColumnWriter<String> writer = ColumnWriter.open(path, ColumnType.UNICODE, options)) {
            for (String value : strings) {
                writer.write(value);
            }
            return writer.finish();
        }
    }

    private static <T> void read(Path path, ColumnType<T> type, Blackhole blackhole) throws IOException {
        try (ColumnReader<T> reader = ColumnReader.open(path, type, ReaderOptions.defaults())) {
            while (reader.hasNext()) {
                blackhole.consume(reader.next());
            }
        }
    }
}
