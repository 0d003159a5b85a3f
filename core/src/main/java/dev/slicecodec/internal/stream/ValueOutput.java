/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.stream;

import java.io.IOException;

/**
 * Sink for encoded values. Multi-byte integers are little-endian.
 */
public interface ValueOutput {

    void writeByte(int b) throws IOException;

    void write(byte[] bytes, int offset, int length) throws IOException;

    default void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    default void writeIntLE(int value) throws IOException {
        writeByte(value);
        writeByte(value >>> 8);
        writeByte(value >>> 16);
        writeByte(value >>> 24);
    }

    default void writeLongLE(long value) throws IOException {
        writeIntLE((int) value);
        writeIntLE((int) (value >>> 32));
    }

    /**
     * Write an unsigned LEB128 varint.
     */
    default void writeVarint(long value) throws IOException {
        while ((value & ~0x7FL) != 0) {
            writeByte((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        writeByte((int) value);
    }
}
