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

/**
 * Compresses and decompresses single blocks of a column file.
 */
public interface BlockCodec {

    /**
     * Compress a range of the given block.
     *
     * @param data the uncompressed block
     * @param offset start of the range
     * @param length length of the range
     * @return the compressed payload
     * @throws IOException if compression fails
     */
    byte[] compress(byte[] data, int offset, int length) throws IOException;

    /**
     * Decompress one block payload.
     *
     * @param compressed buffer holding exactly the compressed payload
     * @param uncompressedSize the expected size of uncompressed data
     * @return the uncompressed data
     * @throws IOException if decompression fails or the size does not match
     */
    byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException;

    /**
     * Get the name of this codec.
     */
    String getName();
}
