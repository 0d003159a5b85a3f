/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.reader;

import java.util.Map;
import java.util.Set;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.internal.config.OptionValues;
import dev.slicecodec.metadata.Compression;

/**
 * Configuration of a {@link ColumnReader}.
 */
public final class ReaderOptions {

    public static final String COMPRESSION = "compression";
    public static final String HASHFILTER = "hashfilter";
    public static final String WANT_COUNT = "want_count";
    public static final String CALLBACK = "callback";
    public static final String CALLBACK_INTERVAL = "callback_interval";
    public static final String CALLBACK_OFFSET = "callback_offset";

    private static final Set<String> KEYS = Set.of(COMPRESSION, HASHFILTER, WANT_COUNT, CALLBACK,
            CALLBACK_INTERVAL, CALLBACK_OFFSET);

    private final Compression compression;
    private final HashFilter hashFilter;
    private final long wantCount;
    private final ProgressCallback callback;
    private final long callbackInterval;
    private final long callbackOffset;

    private ReaderOptions(Builder builder) {
        this.compression = builder.compression;
        this.hashFilter = builder.hashFilter;
        this.wantCount = builder.wantCount;
        this.callback = builder.callback;
        this.callbackInterval = builder.callbackInterval;
        this.callbackOffset = builder.callbackOffset;
    }

    public static ReaderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options from a map keyed by {@code compression}, {@code hashfilter}, {@code want_count},
     * {@code callback}, {@code callback_interval} and {@code callback_offset}.
     *
     * @throws IllegalArgumentException for unknown keys or values of the wrong type
     */
    public static ReaderOptions fromMap(Map<String, ?> options) {
        OptionValues.checkKnownKeys(options, KEYS);
        Builder builder = builder()
                .compression(OptionValues.asCompression(COMPRESSION, options.get(COMPRESSION)))
                .hashFilter(OptionValues.asHashFilter(HASHFILTER, options.get(HASHFILTER)));
        if (options.get(WANT_COUNT) != null) {
            builder.wantCount(OptionValues.asLong(WANT_COUNT, options.get(WANT_COUNT)));
        }
        Object callback = options.get(CALLBACK);
        if (callback != null) {
            if (!(callback instanceof ProgressCallback progressCallback)) {
                throw new IllegalArgumentException("Option '" + CALLBACK + "' must be a ProgressCallback, got "
                        + callback.getClass().getName());
            }
            Object interval = options.get(CALLBACK_INTERVAL);
            if (interval == null) {
                throw new IllegalArgumentException("Option '" + CALLBACK + "' requires '" + CALLBACK_INTERVAL + "'");
            }
            builder.callback(progressCallback, OptionValues.asLong(CALLBACK_INTERVAL, interval));
        }
        if (options.get(CALLBACK_OFFSET) != null) {
            builder.callbackOffset(OptionValues.asLong(CALLBACK_OFFSET, options.get(CALLBACK_OFFSET)));
        }
        return builder.build();
    }

    /**
     * The compression the file must have been written with, or null to accept any.
     */
    public Compression compression() {
        return compression;
    }

    public HashFilter hashFilter() {
        return hashFilter;
    }

    /**
     * Maximum number of values to return; negative for all.
     */
    public long wantCount() {
        return wantCount;
    }

    public ProgressCallback callback() {
        return callback;
    }

    public long callbackInterval() {
        return callbackInterval;
    }

    public long callbackOffset() {
        return callbackOffset;
    }

    public static final class Builder {

        private Compression compression;
        private HashFilter hashFilter;
        private long wantCount = -1;
        private ProgressCallback callback;
        private long callbackInterval;
        private long callbackOffset;

        private Builder() {
        }

        public Builder compression(Compression compression) {
            this.compression = compression;
            return this;
        }

        public Builder hashFilter(HashFilter hashFilter) {
            this.hashFilter = hashFilter;
            return this;
        }

        public Builder wantCount(long wantCount) {
            this.wantCount = wantCount;
            return this;
        }

        /**
         * Call {@code callback} every {@code interval} values.
         *
         * @throws IllegalArgumentException if the interval is not positive
         */
        public Builder callback(ProgressCallback callback, long interval) {
            if (interval <= 0) {
                throw new IllegalArgumentException("Callback interval must be positive, got " + interval);
            }
            this.callback = callback;
            this.callbackInterval = interval;
            return this;
        }

        /**
         * Added to the count passed to the callback, for progress across several slices or files.
         */
        public Builder callbackOffset(long callbackOffset) {
            this.callbackOffset = callbackOffset;
            return this;
        }

        public ReaderOptions build() {
            return new ReaderOptions(this);
        }
    }
}
