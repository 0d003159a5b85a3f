/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;
import java.util.Comparator;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;

/**
 * 32-bit signed integers, little-endian. {@link Integer#MIN_VALUE} marks None.
 */
public final class Int32Codec implements TypeCodec<Integer> {

    static final int NONE = Integer.MIN_VALUE;

    private final String name;

    public Int32Codec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Integer> valueClass() {
        return Integer.class;
    }

    @Override
    public Integer coerce(Object value) {
        long v = Coercions.toLong(name, value);
        if (v <= NONE || v > Integer.MAX_VALUE) {
            throw RejectedValueException.outOfRange(name, value);
        }
        return (int) v;
    }

    @Override
    public void encode(Integer value, ValueOutput out) throws IOException {
        out.writeIntLE(value);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeIntLE(NONE);
    }

    @Override
    public Integer decode(ValueInput in) throws IOException {
        int v = in.readIntLE();
        return v == NONE ? null : v;
    }

    @Override
    public long hash(Integer value) {
        return HashValue.hashLong(value);
    }

    @Override
    public Comparator<Integer> comparator() {
        return Comparator.naturalOrder();
    }
}
