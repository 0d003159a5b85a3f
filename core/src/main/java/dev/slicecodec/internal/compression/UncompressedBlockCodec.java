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

/**
 * Codec for uncompressed blocks (passthrough).
 */
public class UncompressedBlockCodec implements BlockCodec {

    @Override
    public byte[] compress(byte[] data, int offset, int length) {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        if (compressed.remaining() != uncompressedSize) {
            throw new IOException("Uncompressed block size mismatch: expected " + uncompressedSize +
                    ", got " + compressed.remaining());
        }
        byte[] data = new byte[uncompressedSize];
        compressed.get(data);
        return data;
    }

    @Override
    public String getName() {
        return "NONE";
    }
}
