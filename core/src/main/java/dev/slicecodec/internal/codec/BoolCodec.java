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
 * Booleans as one byte each; {@code 0xFF} marks None. Integral 0 and 1 are accepted as input.
 */
public final class BoolCodec implements TypeCodec<Boolean> {

    private static final int NONE = 0xFF;

    private final String name;

    public BoolCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Boolean> valueClass() {
        return Boolean.class;
    }

    @Override
    public Boolean coerce(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        long v = Coercions.toLong(name, value);
        if (v == 0 || v == 1) {
            return v == 1;
        }
        throw RejectedValueException.outOfRange(name, value);
    }

    @Override
    public void encode(Boolean value, ValueOutput out) throws IOException {
        out.writeByte(value ? 1 : 0);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeByte(NONE);
    }

    @Override
    public Boolean decode(ValueInput in) throws IOException {
        int b = in.readByte();
        return switch (b) {
            case 0 -> Boolean.FALSE;
            case 1 -> Boolean.TRUE;
            case NONE -> null;
            default -> throw new IOException("Corrupt bool column: unexpected byte " + b);
        };
    }

    @Override
    public long hash(Boolean value) {
        return HashValue.hashBoolean(value);
    }

    @Override
    public Comparator<Boolean> comparator() {
        return Comparator.naturalOrder();
    }
}
