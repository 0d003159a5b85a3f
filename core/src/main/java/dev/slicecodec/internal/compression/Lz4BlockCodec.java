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

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4FastDecompressor;

/**
 * Codec for LZ4 compressed blocks (standard LZ4 block format, no framing).
 */
public class Lz4BlockCodec implements BlockCodec {

    private final LZ4Compressor compressor;
    private final LZ4FastDecompressor decompressor;

    public Lz4BlockCodec() {
        LZ4Factory factory = LZ4Factory.fastestInstance();
        this.compressor = factory.fastCompressor();
        this.decompressor = factory.fastDecompressor();
    }

    @Override
    public byte[] compress(byte[] data, int offset, int length) {
        return compressor.compress(data, offset, length);
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        try {
            byte[] uncompressed = new byte[uncompressedSize];
            ByteBuffer dest = ByteBuffer.wrap(uncompressed);

            int compressedLength = compressed.remaining();
            int consumedLength = decompressor.decompress(compressed, compressed.position(), dest, 0, uncompressedSize);

            if (consumedLength != compressedLength) {
                throw new IOException(
                        "LZ4 decompression did not consume all input: expected " + compressedLength +
                                " bytes, consumed " + consumedLength);
            }

            return uncompressed;
        }
        catch (IOException e) {
            throw e;
        }
        catch (Exception e) {
            throw new IOException("LZ4 decompression failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
