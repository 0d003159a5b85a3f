/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.compression;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.GZIPOutputStream;
import java.util.zip.Inflater;

/**
 * Codec writing each block as one GZIP member.
 * <p>
 * Decompression uses Inflater directly instead of GZIPInputStream and accepts exactly one member per block,
 * verifying its CRC and size trailer.
 * </p>
 */
public class GzipBlockCodec implements BlockCodec {

    private static final int GZIP_MAGIC = 0x8b1f;
    private static final int FHCRC = 2;
    private static final int FEXTRA = 4;
    private static final int FNAME = 8;
    private static final int FCOMMENT = 16;
    private static final int TRAILER_SIZE = 8;

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        ByteArrayOutputStream result = new ByteArrayOutputStream(Math.max(64, length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(result, 8192)) {
            gzip.write(data, offset, length);
        }
        return result.toByteArray();
    }

    @Override
    public byte[] decompress(ByteBuffer compressed, int uncompressedSize) throws IOException {
        int headerEnd = skipGzipHeader(compressed);
        int deflateStart = compressed.position() + headerEnd;
        ByteBuffer deflated = compressed.slice(deflateStart, compressed.remaining() - headerEnd);

        // one spare byte, so that a member longer than declared is detected
        byte[] buffer = new byte[uncompressedSize + 1];
        int total = 0;
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(deflated);
            while (!inflater.finished()) {
                if (total == buffer.length) {
                    throw new IOException("Decompressed size mismatch: block inflates beyond the declared "
                            + uncompressedSize + " bytes");
                }
                int inflated = inflater.inflate(buffer, total, buffer.length - total);
                if (inflated == 0 && !inflater.finished()) {
                    if (inflater.needsDictionary()) {
                        throw new IOException("GZIP stream requires dictionary");
                    }
                    throw new IOException("Truncated GZIP data");
                }
                total += inflated;
            }
            if (total != uncompressedSize) {
                throw new IOException("Decompressed size mismatch: expected " + uncompressedSize +
                        " but got " + total);
            }
            checkTrailer(compressed, deflateStart + deflated.capacity() - inflater.getRemaining(), buffer, total);
        }
        catch (DataFormatException e) {
            throw new IOException("GZIP decompression failed", e);
        }
        finally {
            inflater.end();
        }
        return Arrays.copyOf(buffer, uncompressedSize);
    }

    /**
     * A block is exactly one member: the trailer must follow the deflate data and end the payload.
     */
    private static void checkTrailer(ByteBuffer compressed, int trailerStart, byte[] data, int length) throws IOException {
        if (compressed.limit() - trailerStart != TRAILER_SIZE) {
            throw new IOException("Expected a single GZIP member with an 8 byte trailer, found "
                    + (compressed.limit() - trailerStart) + " bytes after the deflate data");
        }
        ByteBuffer trailer = compressed.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        CRC32 crc = new CRC32();
        crc.update(data, 0, length);
        if (trailer.getInt(trailerStart) != (int) crc.getValue()) {
            throw new IOException("GZIP CRC mismatch");
        }
        if (trailer.getInt(trailerStart + 4) != length) {
            throw new IOException("GZIP size mismatch in trailer");
        }
    }

    private int skipGzipHeader(ByteBuffer buffer) throws IOException {
        int start = buffer.position();
        if (buffer.remaining() < 10) {
            throw new IOException("GZIP data too short for header");
        }

        int magic = (buffer.get(start) & 0xff) | ((buffer.get(start + 1) & 0xff) << 8);
        if (magic != GZIP_MAGIC) {
            throw new IOException("Not in GZIP format");
        }

        // Compression method must be 8 (deflate)
        if (buffer.get(start + 2) != 8) {
            throw new IOException("Unsupported compression method: " + buffer.get(start + 2));
        }

        int flags = buffer.get(start + 3) & 0xff;
        int offset = 10;

        if ((flags & FEXTRA) != 0) {
            if (offset + 2 > buffer.remaining()) {
                throw new IOException("Truncated GZIP extra field");
            }
            int extraLen = (buffer.get(start + offset) & 0xff) | ((buffer.get(start + offset + 1) & 0xff) << 8);
            offset += 2 + extraLen;
        }

        if ((flags & FNAME) != 0) {
            while (offset < buffer.remaining() && buffer.get(start + offset) != 0) {
                offset++;
            }
            offset++; // null terminator
        }

        if ((flags & FCOMMENT) != 0) {
            while (offset < buffer.remaining() && buffer.get(start + offset) != 0) {
                offset++;
            }
            offset++; // null terminator
        }

        if ((flags & FHCRC) != 0) {
            offset += 2;
        }

        if (offset >= buffer.remaining()) {
            throw new IOException("GZIP header extends beyond data");
        }

        return offset;
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
