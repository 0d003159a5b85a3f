/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.compression;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;

import com.github.luben.zstd.Zstd;

/**
 * Codec for ZSTD compressed blocks.
 */
public class ZstdBlockCodec implements BlockCodec {

    private static final int LEVEL = 3;

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        byte[] output = new byte[(int) Zstd.compressBound(length)];
        long compressedSize = Zstd.compressByteArray(output, 0, output.length, data, offset, length, LEVEL);
        if (Zstd.isError(compressedSize)) {
            throw new IOException("ZSTD compression failed: " + Zstd.getErrorName(compressedSize));
        }
        return Arrays.copyOf(output, (int) compressedSize);
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] input = CodecBuffers.toArray(compressed);
        byte[] uncompressed = new byte[uncompressedSize];
        long actualSize = Zstd.decompressByteArray(uncompressed, 0, uncompressedSize, input, 0, input.length);

        if (Zstd.isError(actualSize)) {
            throw new IOException("ZSTD decompression failed: " + Zstd.getErrorName(actualSize));
        }
        if (actualSize != uncompressedSize) {
            throw new IOException(
                    "ZSTD decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
