/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.metadata;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.slicecodec.internal.codec.AsciiCodec;
import dev.slicecodec.internal.codec.BoolCodec;
import dev.slicecodec.internal.codec.BytesCodec;
import dev.slicecodec.internal.codec.ComplexCodec;
import dev.slicecodec.internal.codec.DateCodec;
import dev.slicecodec.internal.codec.DateTimeCodec;
import dev.slicecodec.internal.codec.Float32Codec;
import dev.slicecodec.internal.codec.Float64Codec;
import dev.slicecodec.internal.codec.Int32Codec;
import dev.slicecodec.internal.codec.Int64Codec;
import dev.slicecodec.internal.codec.JsonCodec;
import dev.slicecodec.internal.codec.NumberCodec;
import dev.slicecodec.internal.codec.ParsedCodec;
import dev.slicecodec.internal.codec.ParsedCodecs;
import dev.slicecodec.internal.codec.TimeCodec;
import dev.slicecodec.internal.codec.UnicodeCodec;
import dev.slicecodec.internal.codec.TypeCodec;
import dev.slicecodec.value.Complex;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;

/**
 * The logical type of a column.
 * <p>
 * The set of types is closed; every type is one of the constants below and is identified by its
 * {@linkplain #getName() name}. A {@code parsed:} type stores and reads back exactly like its base
 * type but additionally accepts text input.
 * </p>
 *
 * @param <T> the Java type of the column's values
 */
public final class ColumnType<T> {

    private static final Map<String, ColumnType<?>> BY_NAME = new LinkedHashMap<>();

    public static final ColumnType<Integer> INT32 = register(new Int32Codec("int32"));
    public static final ColumnType<Long> INT64 = register(new Int64Codec("int64"));
    public static final ColumnType<Float> FLOAT32 = register(new Float32Codec("float32"));
    public static final ColumnType<Double> FLOAT64 = register(new Float64Codec("float64"));
    public static final ColumnType<Complex> COMPLEX32 = register(new ComplexCodec("complex32", true));
    public static final ColumnType<Complex> COMPLEX64 = register(new ComplexCodec("complex64", false));
    public static final ColumnType<Boolean> BOOL = register(new BoolCodec("bool"));
    public static final ColumnType<Number> NUMBER = register(new NumberCodec("number"));
    public static final ColumnType<byte[]> BYTES = register(new BytesCodec("bytes"));
    public static final ColumnType<String> ASCII = register(new AsciiCodec("ascii"));
    public static final ColumnType<String> UNICODE = register(new UnicodeCodec("unicode"));
    public static final ColumnType<LocalDate> DATE = register(new DateCodec("date"));
    public static final ColumnType<FoldedTime> TIME = register(new TimeCodec("time"));
    public static final ColumnType<FoldedDateTime> DATETIME = register(new DateTimeCodec("datetime"));
    public static final ColumnType<Object> JSON = register(new JsonCodec("json"));

    public static final ColumnType<Integer> PARSED_INT32 = register(ParsedCodecs.int32());
    public static final ColumnType<Long> PARSED_INT64 = register(ParsedCodecs.int64());
    public static final ColumnType<Float> PARSED_FLOAT32 = register(ParsedCodecs.float32());
    public static final ColumnType<Double> PARSED_FLOAT64 = register(ParsedCodecs.float64());
    public static final ColumnType<Complex> PARSED_COMPLEX32 = register(ParsedCodecs.complex32());
    public static final ColumnType<Complex> PARSED_COMPLEX64 = register(ParsedCodecs.complex64());
    public static final ColumnType<Number> PARSED_NUMBER = register(ParsedCodecs.number());
    public static final ColumnType<LocalDate> PARSED_DATE = register(ParsedCodecs.date());
    public static final ColumnType<FoldedTime> PARSED_TIME = register(ParsedCodecs.time());
    public static final ColumnType<FoldedDateTime> PARSED_DATETIME = register(ParsedCodecs.dateTime());
    public static final ColumnType<Object> PARSED_JSON = register(ParsedCodecs.json());

    private final TypeCodec<T> codec;

    private ColumnType(TypeCodec<T> codec) {
        this.codec = codec;
    }

    private static <T> ColumnType<T> register(TypeCodec<T> codec) {
        ColumnType<T> type = new ColumnType<>(codec);
        BY_NAME.put(codec.name(), type);
        return type;
    }

    /**
     * Look up a type by name, e.g. {@code "int64"} or {@code "parsed:date"}.
     *
     * @throws IllegalArgumentException if there is no such type
     */
    public static ColumnType<?> forName(String name) {
        ColumnType<?> type = BY_NAME.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown column type: " + name);
        }
        return type;
    }

    public static Collection<ColumnType<?>> values() {
        return Collections.unmodifiableCollection(BY_NAME.values());
    }

    public String getName() {
        return codec.name();
    }

    public boolean isParsed() {
        return codec instanceof ParsedCodec;
    }

    /**
     * Whether columns of this type track min and max.
     */
    public boolean isOrdered() {
        return codec.comparator() != null;
    }

    public Class<T> valueClass() {
        return codec.valueClass();
    }

    /**
     * The codec implementing this type. Not part of the stable API.
     */
    public TypeCodec<T> codec() {
        return codec;
    }

    /**
     * Convert a value to what a column of this type stores.
     *
     * @throws dev.slicecodec.value.RejectedValueException if the value cannot be stored
     */
    public T coerce(Object value) {
        return codec.coerce(value);
    }

    public boolean accepts(Object value) {
        return codec.accepts(value);
    }

    /**
     * The slicing hash of a value as stored in a column of this type. {@code null} hashes to 0.
     *
     * @throws dev.slicecodec.value.RejectedValueException if the value cannot be stored
     */
    public long hash(Object value) {
        if (value == null) {
            return 0;
        }
        return codec.hash(codec.coerce(value));
    }

    @Override
    public String toString() {
        return codec.name();
    }
}
