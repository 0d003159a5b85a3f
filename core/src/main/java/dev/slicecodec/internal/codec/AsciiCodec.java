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
 * 7-bit text. Accepts strings and byte arrays, returns strings; anything outside US-ASCII is rejected.
 */
public final class AsciiCodec implements TypeCodec<String> {

    private final String name;

    public AsciiCodec(String name) {
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
        if (value instanceof String text) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) > 0x7F) {
                    throw nonAscii(i);
                }
            }
            return text;
        }
        if (value instanceof byte[] bytes) {
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] < 0) {
                    throw nonAscii(i);
                }
            }
            return new String(bytes, StandardCharsets.US_ASCII);
        }
        throw RejectedValueException.wrongType(name, value);
    }

    private RejectedValueException nonAscii(int index) {
        return new RejectedValueException(Reason.NON_ASCII, name, "non-ASCII character at index " + index);
    }

    @Override
    public void encode(String value, ValueOutput out) throws IOException {
        LengthPrefix.write(value.getBytes(StandardCharsets.US_ASCII), out);
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        LengthPrefix.writeNone(out);
    }

    @Override
    public String decode(ValueInput in) throws IOException {
        byte[] bytes = LengthPrefix.read(in, name);
        return bytes == null ? null : new String(bytes, StandardCharsets.US_ASCII);
    }

    @Override
    public long hash(String value) {
        return HashValue.hashText(value);
    }
}
