/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.stream;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import dev.slicecodec.internal.compression.BlockCodec;
import dev.slicecodec.internal.compression.BlockCodecFactory;
import dev.slicecodec.metadata.Compression;

/**
 * Source reading the frames written by {@link BlockOutputStream}.
 * Reads continue transparently from one block into the next.
 */
public class BlockInputStream implements ValueInput, Closeable {

    private static final byte[] EMPTY = new byte[0];

    private final InputStream in;
    private final Compression compression;
    private final BlockCodec codec;
    private final String label;
    private final byte[] frameHeader = new byte[BlockStream.FRAME_HEADER_SIZE];

    private byte[] block = EMPTY;
    private int position;
    private int limit;
    private long blocksRead;
    private boolean endOfFrames;

    /**
     * Creates a stream reading from the given input, starting with the file header.
     *
     * @param in source, owned by this stream from now on
     * @param expected compression the caller expects, or null to use whatever the file declares
     * @param label name of the source, used in events and error messages
     * @throws IOException if the header is invalid or declares a different compression
     */
    public BlockInputStream(InputStream in, Compression expected, String label) throws IOException {
        this.in = in;
        this.label = label;
        Compression declared = BlockStream.readFileHeader(in);
        if (expected != null && expected != declared) {
            throw new IOException("Column file '" + label + "' is compressed with " + declared.getSchemeName()
                    + ", not " + expected.getSchemeName());
        }
        this.compression = declared;
        this.codec = BlockCodecFactory.getCodec(declared);
    }

    public Compression getCompression() {
        return compression;
    }

    public long getBlocksRead() {
        return blocksRead;
    }

    @Override
    public boolean atEnd() throws IOException {
        return position == limit && !loadBlock();
    }

    @Override
    public int readByte() throws IOException {
        if (position == limit && !loadBlock()) {
            throw new EOFException("Unexpected end of column file '" + label + "'");
        }
        return block[position++] & 0xFF;
    }

    @Override
    public void readFully(byte[] dest, int offset, int length) throws IOException {
        while (length > 0) {
            if (position == limit && !loadBlock()) {
                throw new EOFException("Unexpected end of column file '" + label + "' inside a value");
            }
            int chunk = Math.min(length, limit - position);
            System.arraycopy(block, position, dest, offset, chunk);
            position += chunk;
            offset += chunk;
            length -= chunk;
        }
    }

    @Override
    public int readIntLE() throws IOException {
        if (limit - position < 4) {
            return ValueInput.super.readIntLE();
        }
        int value = getInt(position);
        position += 4;
        return value;
    }

    @Override
    public long readLongLE() throws IOException {
        if (limit - position < 8) {
            return ValueInput.super.readLongLE();
        }
        long value = (getInt(position) & 0xFFFFFFFFL) | ((long) getInt(position + 4) << 32);
        position += 8;
        return value;
    }

    /**
     * Load the next non-empty block.
     *
     * @return false if there are no more frames
     */
    private boolean loadBlock() throws IOException {
        while (!endOfFrames) {
            int headerRead = in.readNBytes(frameHeader, 0, frameHeader.length);
            if (headerRead == 0) {
                endOfFrames = true;
                return false;
            }
            if (headerRead < frameHeader.length) {
                throw new EOFException("Truncated frame header in column file '" + label + "'");
            }
            ByteBuffer header = ByteBuffer.wrap(frameHeader).order(ByteOrder.LITTLE_ENDIAN);
            int uncompressedSize = header.getInt(0);
            int compressedSize = header.getInt(4);
            if (uncompressedSize < 0 || uncompressedSize > BlockStream.BLOCK_SIZE || compressedSize < 0) {
                throw new IOException("Corrupt frame header in column file '" + label + "': "
                        + uncompressedSize + "/" + compressedSize);
            }

            BlockReadEvent event = new BlockReadEvent();
            event.begin();

            byte[] compressed = in.readNBytes(compressedSize);
            if (compressed.length < compressedSize) {
                throw new EOFException("Truncated block in column file '" + label + "'");
            }
            block = codec.decompress(ByteBuffer.wrap(compressed), uncompressedSize);
            position = 0;
            limit = uncompressedSize;
            blocksRead++;

            event.file = label;
            event.compression = compression.getSchemeName();
            event.uncompressedSize = uncompressedSize;
            event.compressedSize = compressedSize;
            event.commit();

            if (limit > 0) {
                return true;
            }
        }
        return false;
    }

    private int getInt(int offset) {
        return (block[offset] & 0xFF)
                | ((block[offset + 1] & 0xFF) << 8)
                | ((block[offset + 2] & 0xFF) << 16)
                | ((block[offset + 3] & 0xFF) << 24);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
