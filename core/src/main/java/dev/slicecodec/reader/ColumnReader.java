/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.reader;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.internal.codec.TypeCodec;
import dev.slicecodec.internal.stream.BlockInputStream;
import dev.slicecodec.metadata.ColumnType;
import dev.slicecodec.metadata.Compression;

/**
 * Reads the values of one column file, lazily and once.
 *
 * <pre>{@code
 * try (ColumnReader<Long> reader = ColumnReader.open(path, ColumnType.INT64)) {
 *     while (reader.hasNext()) {
 *         Long value = reader.next(); // null for None
 *     }
 * }
 * }</pre>
 *
 * <p>With a {@link HashFilter}, values of other slices are skipped, so that reading a complete column with
 * a filter returns what a writer with the same filter would have written. Before each value, and once more
 * at the end, the progress callback is invoked if the number of values returned so far is a positive
 * multiple of the interval that has not been reported yet. I/O failures during iteration are thrown as
 * {@link UncheckedIOException}.</p>
 *
 * @param <T> the Java type of the column's values
 */
public final class ColumnReader<T> implements Iterator<T>, AutoCloseable {

    private static final Logger LOG = System.getLogger(ColumnReader.class.getName());

    private final Path path;
    private final ColumnType<T> type;
    private final TypeCodec<T> codec;
    private final BlockInputStream in;
    private final HashFilter hashFilter;
    private final long wantCount;
    private final ProgressCallback callback;
    private final long callbackInterval;
    private final long callbackOffset;

    private ReaderState state = ReaderState.OPENED;
    private long returned;
    private long lastReported;
    private T pending;
    private boolean hasPending;

    private ColumnReader(Path path, ColumnType<T> type, ReaderOptions options, BlockInputStream in) {
        this.path = path;
        this.type = type;
        this.codec = type.codec();
        this.in = in;
        this.hashFilter = options.hashFilter();
        this.wantCount = options.wantCount();
        this.callback = options.callback();
        this.callbackInterval = options.callbackInterval();
        this.callbackOffset = options.callbackOffset();
    }

    public static <T> ColumnReader<T> open(Path path, ColumnType<T> type) throws IOException {
        return open(path, type, ReaderOptions.defaults());
    }

    /**
     * Open a column file.
     *
     * @throws IOException if the file is missing, is not a column file, or was written with a different
     *         compression than {@link ReaderOptions#compression()}
     */
    public static <T> ColumnReader<T> open(Path path, ColumnType<T> type, ReaderOptions options) throws IOException {
        InputStream file = new BufferedInputStream(Files.newInputStream(path));
        try {
            BlockInputStream in = new BlockInputStream(file, options.compression(), path.toString());
            LOG.log(Level.DEBUG, "Opened reader for ''{0}'' ({1}, {2})", path, type, in.getCompression().getSchemeName());
            return new ColumnReader<>(path, type, options, in);
        }
        catch (IOException | RuntimeException e) {
            try {
                file.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Read a whole column file.
     */
    public static <T> List<T> readAll(Path path, ColumnType<T> type, ReaderOptions options) throws IOException {
        try (ColumnReader<T> reader = open(path, type, options)) {
            return reader.readAll();
        }
    }

    @Override
    public boolean hasNext() {
        if (hasPending) {
            return true;
        }
        if (state.isTerminal()) {
            return false;
        }
        state = ReaderState.ITERATING;

        if (callback != null && returned > 0 && returned % callbackInterval == 0 && lastReported != returned) {
            lastReported = returned;
            CallbackAction action;
            try {
                action = callback.onProgress(returned + callbackOffset);
            }
            catch (RuntimeException e) {
                state = ReaderState.ABORTED;
                throw e;
            }
            if (action == CallbackAction.STOP) {
                LOG.log(Level.DEBUG, "Reading ''{0}'' stopped by callback after {1} values", path, returned);
                state = ReaderState.STOPPED_BY_CALLBACK;
                return false;
            }
        }
        if (wantCount >= 0 && returned >= wantCount) {
            state = ReaderState.EXHAUSTED;
            return false;
        }

        try {
            while (!in.atEnd()) {
                T value = codec.decode(in);
                if (belongsToSlice(value)) {
                    pending = value;
                    hasPending = true;
                    return true;
                }
            }
        }
        catch (IOException e) {
            state = ReaderState.ABORTED;
            throw new UncheckedIOException(e);
        }
        state = ReaderState.EXHAUSTED;
        return false;
    }

    /**
     * The next value; null stands for None.
     */
    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more values in '" + path + "'");
        }
        T value = pending;
        pending = null;
        hasPending = false;
        returned++;
        return value;
    }

    /**
     * The remaining values as a stream, which closes this reader when closed.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
                .onClose(() -> {
                    try {
                        close();
                    }
                    catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    /**
     * Collect the remaining values. None is represented by null elements.
     */
    public List<T> readAll() {
        List<T> values = new ArrayList<>();
        while (hasNext()) {
            values.add(next());
        }
        return values;
    }

    private boolean belongsToSlice(T value) {
        if (hashFilter == null) {
            return true;
        }
        if (value == null) {
            return hashFilter.routesNone();
        }
        return hashFilter.routes(codec.hash(value));
    }

    public ReaderState state() {
        return state;
    }

    /**
     * Number of values returned so far.
     */
    public long count() {
        return returned;
    }

    public Compression compression() {
        return in.getCompression();
    }

    public ColumnType<T> columnType() {
        return type;
    }

    @Override
    public void close() throws IOException {
        if (state != ReaderState.CLOSED) {
            state = ReaderState.CLOSED;
            hasPending = false;
            pending = null;
            in.close();
        }
    }
}
