/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.writer;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.internal.codec.TypeCodec;
import dev.slicecodec.internal.stream.BlockOutputStream;
import dev.slicecodec.metadata.ColumnFileInfo;
import dev.slicecodec.metadata.ColumnType;
import dev.slicecodec.metadata.Compression;
import dev.slicecodec.value.RejectedValueException;
import dev.slicecodec.value.RejectedValueException.Reason;

/**
 * Writes the values of one column slice to a file.
 *
 * <pre>{@code
 * try (ColumnWriter<Long> writer = ColumnWriter.open(path, ColumnType.INT64, options)) {
 *     for (Object value : values) {
 *         writer.write(value);
 *     }
 *     ColumnFileInfo<Long> info = writer.finish();
 * }
 * }</pre>
 *
 * <p>Data goes to a hidden temporary file next to the target, which is moved into place by
 * {@link #finish()}; the target path only ever holds complete columns. Each value is resolved as follows:</p>
 * <ul>
 *   <li>null is None if the column supports None, otherwise the default if there is one;</li>
 *   <li>other values are coerced by the column type; rejected values are replaced by the default
 *   if there is one;</li>
 *   <li>anything left over is a {@link RejectedValueException}, and the writer is unaffected.</li>
 * </ul>
 * <p>With a {@link HashFilter} only values of the filter's slice are written. An {@link IOException}
 * fails the writer: the temporary file is removed and every later call throws {@link IllegalStateException}.</p>
 *
 * <p>Writers are not thread-safe.</p>
 *
 * @param <T> the Java type of the column's values
 */
public final class ColumnWriter<T> implements AutoCloseable {

    private static final Logger LOG = System.getLogger(ColumnWriter.class.getName());

    private enum State {
        OPEN,
        FINISHED,
        FAILED
    }

    private record Resolved<V>(V value, boolean none) {
    }

    private final Path path;
    private final Path tempPath;
    private final ColumnType<T> type;
    private final TypeCodec<T> codec;
    private final Comparator<? super T> comparator;
    private final boolean noneSupport;
    private final HashFilter hashFilter;
    private final Resolved<T> defaultValue;
    private final BlockOutputStream out;

    private State state = State.OPEN;
    private long count;
    private T min;
    private T max;
    private ColumnFileInfo<T> info;

    private ColumnWriter(Path path, Path tempPath, ColumnType<T> type, WriterOptions options,
                         Resolved<T> defaultValue, BlockOutputStream out) {
        this.path = path;
        this.tempPath = tempPath;
        this.type = type;
        this.codec = type.codec();
        this.comparator = codec.comparator();
        this.noneSupport = options.noneSupport();
        this.hashFilter = options.hashFilter();
        this.defaultValue = defaultValue;
        this.out = out;
    }

    public static <T> ColumnWriter<T> open(Path path, ColumnType<T> type) throws IOException {
        return open(path, type, WriterOptions.defaults());
    }

    /**
     * Open a writer for a new column file.
     *
     * @throws RejectedValueException if the configured default cannot be stored in this column type
     * @throws IllegalArgumentException if None is the default but the column does not support None
     * @throws IOException if the temporary file cannot be created, e.g. because the directory is missing
     */
    public static <T> ColumnWriter<T> open(Path path, ColumnType<T> type, WriterOptions options) throws IOException {
        Resolved<T> defaultValue = resolveDefault(type, options);
        Path tempPath = path.resolveSibling("." + path.getFileName() + ".tmp");
        OutputStream file = Files.newOutputStream(tempPath);
        try {
            BlockOutputStream out = new BlockOutputStream(file, options.compression(), path.toString());
            LOG.log(Level.DEBUG, "Opened writer for ''{0}'' ({1}, {2})", path, type, options);
            return new ColumnWriter<>(path, tempPath, type, options, defaultValue, out);
        }
        catch (IOException | RuntimeException e) {
            try {
                file.close();
                Files.deleteIfExists(tempPath);
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    private static <T> Resolved<T> resolveDefault(ColumnType<T> type, WriterOptions options) {
        if (!options.hasDefault()) {
            return null;
        }
        if (options.defaultValue() == null) {
            if (!options.noneSupport()) {
                throw new IllegalArgumentException("None as default requires none support for column type " + type);
            }
            return new Resolved<>(null, true);
        }
        return new Resolved<>(type.coerce(options.defaultValue()), false);
    }

    /**
     * Append a value.
     *
     * @return true if the value was written, false if it belongs to another slice
     * @throws RejectedValueException if the value cannot be stored and there is no default
     * @throws IOException if writing fails; the writer is failed afterwards
     * @throws IllegalStateException if the writer is finished or failed
     */
    public boolean write(Object value) throws IOException {
        ensureOpen();
        Resolved<T> resolved = resolve(value);
        if (!keeps(resolved)) {
            return false;
        }
        try {
            if (resolved.none()) {
                codec.encodeNone(out);
            }
            else {
                codec.encode(resolved.value(), out);
            }
        }
        catch (IOException | RuntimeException e) {
            fail(e);
            throw e;
        }
        count++;
        if (!resolved.none()) {
            accumulate(resolved.value());
        }
        return true;
    }

    /**
     * Whether {@link #write(Object)} would keep this value, without writing it.
     *
     * @throws RejectedValueException exactly when {@code write} would throw it
     */
    public boolean hashcheck(Object value) {
        return keeps(resolve(value));
    }

    /**
     * Flush the last block and move the file into place. Calling it again returns the same result.
     *
     * @throws IOException if flushing or moving fails; the writer is failed afterwards
     * @throws IllegalStateException if the writer has failed
     */
    public ColumnFileInfo<T> finish() throws IOException {
        if (state == State.FINISHED) {
            return info;
        }
        checkNotFailed();
        try {
            out.finish();
            out.close();
            moveIntoPlace();
        }
        catch (IOException e) {
            fail(e);
            throw e;
        }
        state = State.FINISHED;
        info = new ColumnFileInfo<>(type, noneSupport, out.getCompression(), count, min, max);
        LOG.log(Level.DEBUG, "Finished ''{0}'': {1} values in {2} blocks", path, count, out.getBlocksWritten());
        return info;
    }

    /**
     * Finish the column unless it is already finished or failed.
     */
    @Override
    public void close() throws IOException {
        if (state == State.OPEN) {
            finish();
        }
    }

    private Resolved<T> resolve(Object value) {
        if (value == null) {
            if (noneSupport) {
                return new Resolved<>(null, true);
            }
            if (defaultValue != null) {
                return defaultValue;
            }
            throw new RejectedValueException(Reason.NONE_NOT_SUPPORTED, type.getName(), "None is not supported");
        }
        try {
            return new Resolved<>(codec.coerce(value), false);
        }
        catch (RejectedValueException e) {
            if (defaultValue != null) {
                return defaultValue;
            }
            throw e;
        }
    }

    private boolean keeps(Resolved<T> resolved) {
        if (hashFilter == null) {
            return true;
        }
        if (resolved.none()) {
            return hashFilter.routesNone();
        }
        return hashFilter.routes(codec.hash(resolved.value()));
    }

    private void accumulate(T value) {
        if (comparator == null || !codec.isOrdered(value)) {
            return;
        }
        if (min == null || comparator.compare(value, min) < 0) {
            min = value;
        }
        if (max == null || comparator.compare(value, max) > 0) {
            max = value;
        }
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void fail(Exception cause) {
        state = State.FAILED;
        try {
            out.close();
        }
        catch (IOException e) {
            cause.addSuppressed(e);
        }
        try {
            Files.deleteIfExists(tempPath);
        }
        catch (IOException e) {
            LOG.log(Level.WARNING, "Could not remove temporary file ''{0}'' of failed writer", tempPath);
            cause.addSuppressed(e);
        }
    }

    private void checkNotFailed() {
        if (state == State.FAILED) {
            throw new IllegalStateException("Writer for '" + path + "' has failed");
        }
    }

    private void ensureOpen() {
        checkNotFailed();
        if (state == State.FINISHED) {
            throw new IllegalStateException("Writer for '" + path + "' is finished");
        }
    }

    public long count() {
        return count;
    }

    /**
     * The smallest value written so far, or null if the type is unordered or nothing qualified.
     */
    public T min() {
        return min;
    }

    public T max() {
        return max;
    }

    public Compression compression() {
        return out.getCompression();
    }

    public ColumnType<T> columnType() {
        return type;
    }

    public Path path() {
        return path;
    }
}
