/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;
import dev.slicecodec.value.RejectedValueException.Reason;

/**
 * JSON values, stored as their compact text in the {@code unicode} layout.
 * <p>
 * Input is normalised by a serialise/parse round trip, so the value kept for statistics and hashing
 * is exactly what a reader returns: maps, lists, strings, numbers and booleans. Values that serialise
 * to JSON {@code null} are rejected since they would read back as None.
 * Non-finite doubles are written as bare {@code NaN} and {@code Infinity} tokens.
 * </p>
 */
public final class JsonCodec implements TypeCodec<Object> {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .build();

    private final String name;

    public JsonCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Object> valueClass() {
        return Object.class;
    }

    @Override
    public Object coerce(Object value) {
        if (value instanceof byte[]) {
            throw RejectedValueException.wrongType(name, value);
        }
        Object normalised;
        try {
            normalised = MAPPER.readValue(MAPPER.writeValueAsString(value), Object.class);
        }
        catch (JsonProcessingException e) {
            throw new RejectedValueException(Reason.WRONG_TYPE, name,
                    "not serialisable as JSON: " + value.getClass().getName(), e);
        }
        // JSON null would read back as None
        if (normalised == null) {
            throw RejectedValueException.wrongType(name, value);
        }
        return normalised;
    }

    /**
     * Parse JSON text.
     */
    Object parse(String text) {
        Object value;
        try {
            value = MAPPER.readValue(text, Object.class);
        }
        catch (JsonProcessingException e) {
            throw new RejectedValueException(Reason.UNPARSEABLE, name, "invalid JSON text", e);
        }
        if (value == null) {
            throw RejectedValueException.unparseable(name, text);
        }
        return value;
    }

    @Override
    public void encode(Object value, ValueOutput out) throws IOException {
        LengthPrefix.write(MAPPER.writeValueAsBytes(value), out);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        LengthPrefix.writeNone(out);
    }

    @Override
    public Object decode(ValueInput in) throws IOException {
        byte[] bytes = LengthPrefix.read(in, name);
        return bytes == null ? null : MAPPER.readValue(bytes, Object.class);
    }

    @Override
    public long hash(Object value) {
        try {
            return HashValue.hashText(new String(MAPPER.writeValueAsBytes(value), StandardCharsets.UTF_8));
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Coerced JSON value no longer serialisable", e);
        }
    }
}
