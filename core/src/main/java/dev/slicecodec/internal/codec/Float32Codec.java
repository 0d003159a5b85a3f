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
 * IEEE single precision. Doubles beyond the float range become infinities.
 */
public final class Float32Codec implements TypeCodec<Float> {

    // a NaN payload that Float.floatToIntBits never produces
    static final int NONE_BITS = 0x7F8000DE;

    private final String name;

    public Float32Codec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Float> valueClass() {
        return Float.class;
    }

    @Override
    public Float coerce(Object value) {
        float f = (float) Coercions.toDouble(name, value);
        return Float.isNaN(f) ? Float.NaN : f;
    }

    @Override
    public void encode(Float value, ValueOutput out) throws IOException {
        out.writeIntLE(Float.floatToIntBits(value));
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeIntLE(NONE_BITS);
    }

    @Override
    public Float decode(ValueInput in) throws IOException {
        int bits = in.readIntLE();
        return bits == NONE_BITS ? null : Float.intBitsToFloat(bits);
    }

    @Override
    public long hash(Float value) {
        return HashValue.hashDouble(value);
    }

    @Override
    public Comparator<Float> comparator() {
        return Comparator.naturalOrder();
    }

    @Override
    public boolean isOrdered(Float value) {
        return !value.isNaN();
    }
}
