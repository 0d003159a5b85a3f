/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.stream;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted for each block a column file stream compresses and writes.
 */
@Name("dev.slicecodec.BlockFlush")
@Label("Block Flush")
@Category({"Slicecodec", "I/O"})
@Description("Compression and write of one block of a column file")
public class BlockFlushEvent extends Event {

    @Label("File")
    @Description("Column file the block belongs to")
    public String file;

    @Label("Compression")
    @Description("Compression scheme of the block")
    public String compression;

    @Label("Uncompressed Size")
    @Description("Size of the block before compression (bytes)")
    public int uncompressedSize;

    @Label("Compressed Size")
    @Description("Size of the block payload on disk (bytes)")
    public int compressedSize;
}
