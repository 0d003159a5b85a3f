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

/**
 * IEEE double precision.
 */
public final class Float64Codec implements TypeCodec<Double> {

    static final long NONE_BITS = 0x7FF00000000000DEL;

    private final String name;

    public Float64Codec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Double> valueClass() {
        return Double.class;
    }

    @Override
    public Double coerce(Object value) {
        return Coercions.canonicalNaN(Coercions.toDouble(name, value));
    }

    @Override
    public void encode(Double value, ValueOutput out) throws IOException {
        out.writeLongLE(Double.doubleToLongBits(value));
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeLongLE(NONE_BITS);
    }

    @Override
    public Double decode(ValueInput in) throws IOException {
        long bits = in.readLongLE();
        return bits == NONE_BITS ? null : Double.longBitsToDouble(bits);
    }

    @Override
    public long hash(Double value) {
        return HashValue.hashDouble(value);
    }

    @Override
    public Comparator<Double> comparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isOrdered(Double value) {
        return !value.isNaN();
    }
}
