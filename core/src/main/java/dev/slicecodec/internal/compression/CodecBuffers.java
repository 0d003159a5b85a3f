/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.compression;

import java.nio.ByteBuffer;
import java.util.Arrays;

final class CodecBuffers {

    private CodecBuffers() {
    }

    /**
     * The remaining bytes of the buffer as an array, without copying when the buffer wraps exactly that array.
     */
    static byte[] toArray(ByteBuffer buffer) {
        if (buffer.hasArray() && buffer.arrayOffset() == 0 && buffer.position() == 0
                && buffer.remaining() == buffer.array().length) {
            return buffer.array();
        }
        if (buffer.hasArray()) {
            int start = buffer.arrayOffset() + buffer.position();
            return Arrays.copyOfRange(buffer.array(), start, start + buffer.remaining());
        }
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }
}
