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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.RejectedValueException;

/**
 * Calendar dates packed into an int. A date-time input contributes its date.
 */
public final class DateCodec implements TypeCodec<LocalDate> {

    private static final int NONE = -1;

    private final String name;

    public DateCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<LocalDate> valueClass() {
        return LocalDate.class;
    }

    @Override
    public LocalDate coerce(Object value) {
        LocalDate date;
        if (value instanceof LocalDate d) {
            date = d;
        }
        else if (value instanceof LocalDateTime dateTime) {
            date = dateTime.toLocalDate();
        }
        else if (value instanceof FoldedDateTime dateTime) {
            date = dateTime.dateTime().toLocalDate();
        }
        else {
            throw RejectedValueException.wrongType(name, value);
        }
        if (!TemporalPacking.isSupportedYear(date.getYear())) {
            throw RejectedValueException.outOfRange(name, value);
        }
        return date;
    }

    @Override
    public void encode(LocalDate value, ValueOutput out) throws IOException {
        out.writeIntLE(TemporalPacking.packDate(value));
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeIntLE(NONE);
    }

    @Override
    public LocalDate decode(ValueInput in) throws IOException {
        int packed = in.readIntLE();
        if (packed == NONE) {
            return null;
        }
        try {
            return TemporalPacking.unpackDate(packed);
        }
        catch (DateTimeException e) {
            throw new IOException("Corrupt date column: " + Integer.toHexString(packed), e);
        }
    }

    @Override
    public long hash(LocalDate value) {
        return HashValue.hashDate(value);
    }

    @Override
    public Comparator<LocalDate> comparator() {
        return Comparator.naturalOrder();
    }
}
