/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;

import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;

/**
 * Variable length payloads are prefixed with {@code length + 1} as a varint; a prefix of 0 marks None.
 */
final class LengthPrefix {

    private LengthPrefix() {
    }

    static void write(byte[] payload, ValueOutput out) throws IOException {
        out.writeVarint(payload.length + 1L);
        out.write(payload);
    }

    static void writeNone(ValueOutput out) throws IOException {
        out.writeVarint(0);
    }

    /**
     * @return the payload, or null for None
     */
    static byte[] read(ValueInput in, String typeName) throws IOException {
        long prefix = in.readVarint();
        if (prefix == 0) {
            return null;
        }
        if (prefix - 1 > Integer.MAX_VALUE - 8) {
            throw new IOException("Corrupt " + typeName + " column: length " + (prefix - 1));
        }
        return in.readBytes((int) (prefix - 1));
    }
}
