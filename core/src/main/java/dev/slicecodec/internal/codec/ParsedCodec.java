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
import java.util.function.Function;
import java.util.function.UnaryOperator;

import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;

/**
 * A base codec that additionally accepts text.
 * <p>
 * Strings are trimmed and handed to a parser whose result goes through the base codec's own range
 * checks; other values are first passed through an optional relaxation (parsed integer types truncate
 * floats) and then coerced by the base codec. Everything on disk is the base type's format.
 * </p>
 *
 * @param <T> the base value type
 */
public final class ParsedCodec<T> implements TypeCodec<T> {

    private final TypeCodec<T> base;
    private final String name;
    private final Function<String, ?> parser;
    private final UnaryOperator<Object> relaxation;

    public ParsedCodec(TypeCodec<T> base, Function<String, ?> parser, UnaryOperator<Object> relaxation) {
        this.base = base;
        this.name = "parsed:" + base.name();
        this.parser = parser;
        this.relaxation = relaxation;
    }

    public ParsedCodec(TypeCodec<T> base, Function<String, ?> parser) {
        this(base, parser, UnaryOperator.identity());
    }

    public TypeCodec<T> base() {
        return base;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<T> valueClass() {
        return base.valueClass();
    }

    @Override
    public T coerce(Object value) {
        if (value instanceof String text) {
            return base.coerce(parser.apply(text.strip()));
        }
        return base.coerce(relaxation.apply(value));
    }

    @Override
    public void encode(T value, ValueOutput out) throws IOException {
        base.encode(value, out);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        base.encodeNone(out);
    }

    @Override
    public T decode(ValueInput in) throws IOException {
        return base.decode(in);
    }

    @Override
    public long hash(T value) {
        return base.hash(value);
    }

    @Override
    public Comparator<? super T> comparator() {
        return base.comparator();
    }

    @Override
    public boolean isOrdered(T value) {
        return base.isOrdered(value);
    }

    /**
     * Relaxation for integer types: finite floats are truncated toward zero.
     */
    public static UnaryOperator<Object> truncatingFloats(String typeName) {
        return value -> Coercions.isFloating(value)
                ? Coercions.truncate(typeName, ((Number) value).doubleValue())
                : value;
    }
}
