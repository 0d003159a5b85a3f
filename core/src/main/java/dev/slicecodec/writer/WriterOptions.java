/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.writer;

import java.util.Map;
import java.util.Set;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.internal.config.OptionValues;
import dev.slicecodec.metadata.Compression;

/**
 * Configuration of a {@link ColumnWriter}.
 *
 * <pre>{@code
 * WriterOptions options = WriterOptions.builder()
 *         .compression(Compression.ZSTD)
 *         .noneSupport(true)
 *         .hashFilter(HashFilter.of(2, 8))
 *         .build();
 * }</pre>
 *
 * <p>The default value is checked against the column type when the writer is opened, not here.</p>
 */
public final class WriterOptions {

    public static final String COMPRESSION = "compression";
    public static final String NONE_SUPPORT = "none_support";
    public static final String DEFAULT = "default";
    public static final String HASHFILTER = "hashfilter";

    private static final Set<String> KEYS = Set.of(COMPRESSION, NONE_SUPPORT, DEFAULT, HASHFILTER);

    private final Compression compression;
    private final boolean noneSupport;
    private final boolean hasDefault;
    private final Object defaultValue;
    private final HashFilter hashFilter;

    private WriterOptions(Builder builder) {
        this.compression = builder.compression != null ? builder.compression : Compression.defaultCompression();
        this.noneSupport = builder.noneSupport;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.hashFilter = builder.hashFilter;
    }

    public static WriterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options from a map keyed by {@code compression}, {@code none_support}, {@code default} and
     * {@code hashfilter}. A {@code default} entry mapped to null configures None as the default.
     *
     * @throws IllegalArgumentException for unknown keys or values of the wrong type
     */
    public static WriterOptions fromMap(Map<String, ?> options) {
        OptionValues.checkKnownKeys(options, KEYS);
        Builder builder = builder();
        if (options.get(COMPRESSION) != null) {
            builder.compression(OptionValues.asCompression(COMPRESSION, options.get(COMPRESSION)));
        }
        if (options.get(NONE_SUPPORT) != null) {
            builder.noneSupport(OptionValues.asBoolean(NONE_SUPPORT, options.get(NONE_SUPPORT)));
        }
        if (options.containsKey(DEFAULT)) {
            builder.defaultValue(options.get(DEFAULT));
        }
        builder.hashFilter(OptionValues.asHashFilter(HASHFILTER, options.get(HASHFILTER)));
        return builder.build();
    }

    public Compression compression() {
        return compression;
    }

    public boolean noneSupport() {
        return noneSupport;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * The configured default; only meaningful if {@link #hasDefault()}. May be null (None).
     */
    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * The slice restriction, or null to keep every value.
     */
    public HashFilter hashFilter() {
        return hashFilter;
    }

    @Override
    public String toString() {
        return "WriterOptions[compression=" + compression + ", noneSupport=" + noneSupport
                + (hasDefault ? ", default=" + defaultValue : "")
                + (hashFilter != null ? ", hashFilter=" + hashFilter : "") + "]";
    }

    public static final class Builder {

        private Compression compression;
        private boolean noneSupport;
        private boolean hasDefault;
        private Object defaultValue;
        private HashFilter hashFilter;

        private Builder() {
        }

        public Builder compression(Compression compression) {
            this.compression = compression;
            return this;
        }

        public Builder noneSupport(boolean noneSupport) {
            this.noneSupport = noneSupport;
            return this;
        }

        /**
         * Value stored in place of rejected input (and of None when None is not supported).
         * Passing null makes None the default, which requires {@link #noneSupport(boolean) none support}.
         */
        public Builder defaultValue(Object defaultValue) {
            this.hasDefault = true;
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder hashFilter(HashFilter hashFilter) {
            this.hashFilter = hashFilter;
            return this;
        }

        public WriterOptions build() {
            return new WriterOptions(this);
        }
    }
}
