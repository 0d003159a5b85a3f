/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.slicecodec.metadata.Compression;

/**
 * Factory for creating block codec instances based on the compression scheme.
 */
public final class BlockCodecFactory {

    private static final Logger LOG = System.getLogger(BlockCodecFactory.class.getName());

    private static volatile boolean gzipLogged = false;

    private BlockCodecFactory() {
    }

    /**
     * Get a codec for the given compression scheme. Codecs are not shared between streams.
     *
     * @param compression the compression scheme
     * @return the appropriate codec
     * @throws UnsupportedOperationException if the required library is missing
     */
    public static BlockCodec getCodec(Compression compression) {
        return switch (compression) {
            case NONE -> new UncompressedBlockCodec();
            case GZIP -> {
                logGzipCodec("Java Deflater/Inflater");
                yield new GzipBlockCodec();
            }
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyBlockCodec();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdBlockCodec();
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4BlockCodec();
            }
        };
    }

    private static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot use " + codecName + " compression for column files: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
        }
    }

    private static void logGzipCodec(String name) {
        if (!gzipLogged) {
            gzipLogged = true;
            LOG.log(Level.INFO, "Using GZIP block codec: {0}", name);
        }
    }
}
