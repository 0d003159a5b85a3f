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
 * JFR event emitted for each block a column file stream reads.
 */
@Name("dev.slicecodec.BlockRead")
@Label("Block Read")
@Category({"Slicecodec", "I/O"})
@Description("Read and decompression of one block of a column file")
public class BlockReadEvent extends Event {

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
