/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;

/**
 * Raw byte strings. Text is rejected; use {@code ascii} or {@code unicode} for that.
 */
public final class BytesCodec implements TypeCodec<byte[]> {

    private final String name;

    public BytesCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<byte[]> valueClass() {
        return byte[].class;
    }

    @Override
    public byte[] coerce(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        throw RejectedValueException.wrongType(name, value);
    }

    @Override
    public void encode(byte[] value, ValueOutput out) throws IOException {
        LengthPrefix.write(value, out);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        LengthPrefix.writeNone(out);
    }

    @Override
    public byte[] decode(ValueInput in) throws IOException {
        return LengthPrefix.read(in, name);
    }

    @Override
    public long hash(byte[] value) {
        return HashValue.hashBytes(value);
    }
}
