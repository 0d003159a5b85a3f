/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.stream;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.slicecodec.internal.compression.BlockCodec;
import dev.slicecodec.internal.compression.BlockCodecFactory;
import dev.slicecodec.metadata.Compression;

/**
 * Append-only sink that buffers encoded values into fixed size blocks and writes each full block
 * as one compressed frame.
 * <p>
 * Values are written without regard to block boundaries: a value that does not fit into the rest
 * of the current block continues in the next one.
 * </p>
 */
public class BlockOutputStream implements ValueOutput, Closeable {

    private static final Logger LOG = System.getLogger(BlockOutputStream.class.getName());

    private final OutputStream out;
    private final Compression compression;
    private final BlockCodec codec;
    private final String label;
    private final byte[] block = new byte[BlockStream.BLOCK_SIZE];
    private final byte[] frameHeader = new byte[BlockStream.FRAME_HEADER_SIZE];

    private int position;
    private long blocksWritten;
    private long bytesWritten;
    private boolean closed;

    /**
     * Creates a stream writing to the given output, starting with the file header.
     *
     * @param out destination, owned by this stream from now on
     * @param compression compression applied to each block
     * @param label name of the destination, used in events and log messages
     */
    public BlockOutputStream(OutputStream out, Compression compression, String label) throws IOException {
        this.out = out;
        this.compression = compression;
        this.codec = BlockCodecFactory.getCodec(compression);
        this.label = label;
        BlockStream.writeFileHeader(out, compression);
    }

    public Compression getCompression() {
        return compression;
    }

    /**
     * Number of uncompressed bytes accepted so far.
     */
    public long getBytesWritten() {
        return bytesWritten;
    }

    public long getBlocksWritten() {
        return blocksWritten;
    }

    @Override
    public void writeByte(int b) throws IOException {
        if (position == block.length) {
            flushBlock();
        }
        block[position++] = (byte) b;
        bytesWritten++;
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        bytesWritten += length;
        while (length > 0) {
            if (position == block.length) {
                flushBlock();
            }
            int chunk = Math.min(length, block.length - position);
            System.arraycopy(bytes, offset, block, position, chunk);
            position += chunk;
            offset += chunk;
            length -= chunk;
        }
    }

    @Override
    public void writeIntLE(int value) throws IOException {
        if (block.length - position < 4) {
            ValueOutput.super.writeIntLE(value);
            return;
        }
        putInt(block, position, value);
        position += 4;
        bytesWritten += 4;
    }

    @Override
    public void writeLongLE(long value) throws IOException {
        if (block.length - position < 8) {
            ValueOutput.super.writeLongLE(value);
            return;
        }
        putInt(block, position, (int) value);
        putInt(block, position + 4, (int) (value >>> 32));
        position += 8;
        bytesWritten += 8;
    }

    /**
     * Compress and write the current block, if it holds any data.
     */
    public void flushBlock() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (position == 0) {
            return;
        }

        BlockFlushEvent event = new BlockFlushEvent();
        event.begin();

        byte[] compressed = codec.compress(block, 0, position);
        putInt(frameHeader, 0, position);
        putInt(frameHeader, 4, compressed.length);
        out.write(frameHeader);
        out.write(compressed);

        event.file = label;
        event.compression = compression.getSchemeName();
        event.uncompressedSize = position;
        event.compressedSize = compressed.length;
        event.commit();

        LOG.log(Level.TRACE, "Flushed block {0} of ''{1}'': {2} bytes, {3} compressed",
                blocksWritten, label, position, compressed.length);
        blocksWritten++;
        position = 0;
    }

    /**
     * Write out any buffered data and flush the underlying stream.
     * Failures propagate; nothing is committed silently.
     */
    public void finish() throws IOException {
        flushBlock();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            out.close();
        }
    }

    private static void putInt(byte[] dest, int offset, int value) {
        dest[offset] = (byte) value;
        dest[offset + 1] = (byte) (value >>> 8);
        dest[offset + 2] = (byte) (value >>> 16);
        dest[offset + 3] = (byte) (value >>> 24);
    }
}
