/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.stream;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Source of encoded values, the counterpart of {@link ValueOutput}.
 */
public interface ValueInput {

    /**
     * Largest payload allocated in one piece by {@link #readBytes(int)}.
     */
    int READ_CHUNK_SIZE = BlockStream.BLOCK_SIZE;

    /**
     * Returns true if the stream ended cleanly, i.e. there is no further value to decode.
     */
    boolean atEnd() throws IOException;

    /**
     * Read one unsigned byte.
     *
     * @throws EOFException if the stream ends
     */
    int readByte() throws IOException;

    void readFully(byte[] dest, int offset, int length) throws IOException;

    /**
     * Read a payload of the given length. Long payloads are read in chunks, so that a corrupt length
     * fails with {@link EOFException} once the data runs out instead of allocating the full length up front.
     */
    default byte[] readBytes(int length) throws IOException {
        if (length < 0) {
            throw new IOException("Negative payload length: " + length);
        }
        if (length <= READ_CHUNK_SIZE) {
            byte[] bytes = new byte[length];
            readFully(bytes, 0, length);
            return bytes;
        }
        List<byte[]> chunks = new ArrayList<>();
        int remaining = length;
        while (remaining > 0) {
            byte[] chunk = new byte[Math.min(remaining, READ_CHUNK_SIZE)];
            readFully(chunk, 0, chunk.length);
            chunks.add(chunk);
            remaining -= chunk.length;
        }
        byte[] bytes = new byte[length];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, bytes, offset, chunk.length);
            offset += chunk.length;
        }
        return bytes;
    }

    default int readIntLE() throws IOException {
        return readByte() | (readByte() << 8) | (readByte() << 16) | (readByte() << 24);
    }

    default long readLongLE() throws IOException {
        return (readIntLE() & 0xFFFFFFFFL) | ((long) readIntLE() << 32);
    }

    /**
     * Read an unsigned LEB128 varint.
     */
    default long readVarint() throws IOException {
        long result = 0;
        int shift = 0;
        while (shift < 64) {
            int b = readByte();
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("Malformed varint");
    }
}
