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
import java.io.InputStream;
import java.io.OutputStream;

import dev.slicecodec.metadata.Compression;

/**
 * Constants and header handling shared by {@link BlockOutputStream} and {@link BlockInputStream}.
 * <p>
 * A column file starts with a six byte header ({@code "SLCF"}, format version, compression id),
 * followed by frames of {@code [uncompressed length: int32 LE][compressed length: int32 LE][payload]}.
 * Each payload holds at most {@link #BLOCK_SIZE} bytes of encoded values once decompressed.
 * </p>
 */
public final class BlockStream {

    /**
     * Size of the uncompressed block buffer.
     */
    public static final int BLOCK_SIZE = 128 * 1024;

    static final int FRAME_HEADER_SIZE = 8;

    private static final byte[] MAGIC = { 'S', 'L', 'C', 'F' };
    private static final int FORMAT_VERSION = 1;
    private static final int FILE_HEADER_SIZE = MAGIC.length + 2;

    private BlockStream() {
    }

    static void writeFileHeader(OutputStream out, Compression compression) throws IOException {
        byte[] header = new byte[FILE_HEADER_SIZE];
        System.arraycopy(MAGIC, 0, header, 0, MAGIC.length);
        header[MAGIC.length] = FORMAT_VERSION;
        header[MAGIC.length + 1] = (byte) compression.getId();
        out.write(header);
    }

    static Compression readFileHeader(InputStream in) throws IOException {
        byte[] header = in.readNBytes(FILE_HEADER_SIZE);
        if (header.length < FILE_HEADER_SIZE) {
            throw new EOFException("File too short for column file header");
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (header[i] != MAGIC[i]) {
                throw new IOException("Not a column file (bad magic)");
            }
        }
        if (header[MAGIC.length] != FORMAT_VERSION) {
            throw new IOException("Unsupported column file format version: " + header[MAGIC.length]);
        }
        try {
            return Compression.fromId(header[MAGIC.length + 1] & 0xFF);
        }
        catch (IllegalArgumentException e) {
            throw new IOException("Corrupt column file header", e);
        }
    }
}
