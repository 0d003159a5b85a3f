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
 * 64-bit signed integers, little-endian. {@link Long#MIN_VALUE} marks None.
 */
public final class Int64Codec implements TypeCodec<Long> {

    static final long NONE = Long.MIN_VALUE;

    private final String name;

    public Int64Codec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Long> valueClass() {
        return Long.class;
    }

    @Override
    public Long coerce(Object value) {
        long v = Coercions.toLong(name, value);
        if (v == NONE) {
            throw RejectedValueException.outOfRange(name, value);
        }
        return v;
    }

    @Override
    public void encode(Long value, ValueOutput out) throws IOException {
        out.writeLongLE(value);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeLongLE(NONE);
    }

    @Override
    public Long decode(ValueInput in) throws IOException {
        long v = in.readLongLE();
        return v == NONE ? null : v;
    }

    @Override
    public long hash(Long value) {
        return HashValue.hashLong(value);
    }

    @Override
    public Comparator<Long> comparator() {
        return Comparator.naturalOrder();
    }
}
