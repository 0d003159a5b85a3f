/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.metadata;

import java.util.Locale;

/**
 * Block compression schemes for column files.
 * The id is stored in the file header so readers can verify they use the scheme the file was written with.
 */
public enum Compression {
    NONE("none", 0),
    GZIP("gzip", 1),
    SNAPPY("snappy", 2),
    ZSTD("zstd", 3),
    LZ4("lz4", 4);

    /**
     * System property naming the compression used when none is configured explicitly.
     */
    public static final String DEFAULT_COMPRESSION_PROPERTY = "slicecodec.compression";

    private final String schemeName;
    private final int id;

    Compression(String schemeName, int id) {
        this.schemeName = schemeName;
        this.id = id;
    }

    public String getSchemeName() {
        return schemeName;
    }

    public int getId() {
        return id;
    }

    public static Compression fromId(int id) {
        for (Compression compression : values()) {
            if (compression.id == id) {
                return compression;
            }
        }
        throw new IllegalArgumentException("Unknown compression id: " + id);
    }

    public static Compression fromName(String name) {
        String lowerCase = name.trim().toLowerCase(Locale.ROOT);
        for (Compression compression : values()) {
            if (compression.schemeName.equals(lowerCase)) {
                return compression;
            }
        }
        throw new IllegalArgumentException("Unknown compression: " + name);
    }

    /**
     * The compression configured via {@value #DEFAULT_COMPRESSION_PROPERTY}, or {@link #GZIP}.
     */
    public static Compression defaultCompression() {
        String configured = System.getProperty(DEFAULT_COMPRESSION_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return GZIP;
        }
        return fromName(configured);
    }
}
