/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.Comparator;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.FoldedTime;
import dev.slicecodec.value.RejectedValueException;

/**
 * Times of day with microsecond precision and a fold bit, packed into a long.
 */
public final class TimeCodec implements TypeCodec<FoldedTime> {

    private static final long NONE = -1L;

    private final String name;

    public TimeCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<FoldedTime> valueClass() {
        return FoldedTime.class;
    }

    @Override
    public FoldedTime coerce(Object value) {
        if (value instanceof FoldedTime time) {
            return time;
        }
        if (value instanceof LocalTime time) {
            return FoldedTime.of(time);
        }
        throw RejectedValueException.wrongType(name, value);
    }

    @Override
    public void encode(FoldedTime value, ValueOutput out) throws IOException {
        out.writeLongLE(TemporalPacking.packTime(value));
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeLongLE(NONE);
    }

    @Override
    public FoldedTime decode(ValueInput in) throws IOException {
        long packed = in.readLongLE();
        if (packed == NONE) {
            return null;
        }
        try {
            return TemporalPacking.unpackTime(packed);
        }
        catch (DateTimeException e) {
            throw new IOException("Corrupt time column: " + Long.toHexString(packed), e);
        }
    }

    @Override
    public long hash(FoldedTime value) {
        return HashValue.hashTime(value);
    }

    @Override
    public Comparator<FoldedTime> comparator() {
        return Comparator.naturalOrder();
    }
}
