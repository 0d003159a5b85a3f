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

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;
import dev.slicecodec.value.RejectedValueException.Reason;

/**
 * Text stored as UTF-8. Byte arrays are rejected, as are strings with unpaired surrogates.
 */
public final class UnicodeCodec implements TypeCodec<String> {

    private final String name;

    public UnicodeCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<String> valueClass() {
        return String.class;
    }

    @Override
    public String coerce(Object value) {
        if (!(value instanceof String text)) {
            throw RejectedValueException.wrongType(name, value);
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
            }
            else if (Character.isSurrogate(c)) {
                throw new RejectedValueException(Reason.INVALID_UNICODE, name, "unpaired surrogate at index " + i);
            }
        }
        return text;
    }

    @Override
    public void encode(String value, ValueOutput out) throws IOException {
        LengthPrefix.write(value.getBytes(StandardCharsets.UTF_8), out);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        LengthPrefix.writeNone(out);
    }

    @Override
    public String decode(ValueInput in) throws IOException {
        byte[] bytes = LengthPrefix.read(in, name);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public long hash(String value) {
        return HashValue.hashText(value);
    }
}
