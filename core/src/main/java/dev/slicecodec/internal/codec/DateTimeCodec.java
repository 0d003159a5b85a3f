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
import java.time.LocalDateTime;
import java.util.Comparator;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.RejectedValueException;

/**
 * Local date-times with microsecond precision and a fold bit, packed into a long.
 */
public final class DateTimeCodec implements TypeCodec<FoldedDateTime> {

    private static final long NONE = -1L;

    private final String name;

    public DateTimeCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<FoldedDateTime> valueClass() {
        return FoldedDateTime.class;
    }

    @Override
    public FoldedDateTime coerce(Object value) {
        FoldedDateTime dateTime;
        if (value instanceof FoldedDateTime folded) {
            dateTime = folded;
        }
        else if (value instanceof LocalDateTime local) {
            dateTime = FoldedDateTime.of(local);
        }
        else {
            throw RejectedValueException.wrongType(name, value);
        }
        if (!TemporalPacking.isSupportedYear(dateTime.dateTime().getYear())) {
            throw RejectedValueException.outOfRange(name, value);
        }
        return dateTime;
    }

    @Override
    public void encode(FoldedDateTime value, ValueOutput out) throws IOException {
        out.writeLongLE(TemporalPacking.packDateTime(value));
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeLongLE(NONE);
    }

    @Override
    public FoldedDateTime decode(ValueInput in) throws IOException {
        long packed = in.readLongLE();
        if (packed == NONE) {
            return null;
        }
        try {
            return TemporalPacking.unpackDateTime(packed);
        }
        catch (DateTimeException e) {
            throw new IOException("Corrupt datetime column: " + Long.toHexString(packed), e);
        }
    }

    @Override
    public long hash(FoldedDateTime value) {
        return HashValue.hashDateTime(value);
    }

    @Override
    public Comparator<FoldedDateTime> comparator() {
        return Comparator.naturalOrder();
    }
}
