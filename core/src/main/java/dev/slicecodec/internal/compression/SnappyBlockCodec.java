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

import org.xerial.snappy.Snappy;

/**
 * Codec for Snappy compressed blocks.
 */
public class SnappyBlockCodec implements BlockCodec {

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        byte[] output = new byte[Snappy.maxCompressedLength(length)];
        int compressedSize = Snappy.compress(data, offset, length, output, 0);
        return Arrays.copyOf(output, compressedSize);
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        byte[] input = CodecBuffers.toArray(compressed);
        byte[] uncompressed = new byte[uncompressedSize];
        int actualSize = Snappy.uncompress(input, 0, input.length, uncompressed, 0);

        if (actualSize != uncompressedSize) {
            throw new IOException(
                    "Snappy decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
