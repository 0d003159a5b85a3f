/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;

/**
 * Numbers of any kind: 64-bit integers, integers of unbounded magnitude and doubles.
 * <p>
 * Each value starts with a tag byte. Integers that fit a long are always stored and returned as
 * {@code Long}; larger ones as {@code BigInteger}, written as a varint length followed by the
 * big-endian two's complement bytes. Values are not aligned to blocks and may span any number of them.
 * </p>
 */
public final class NumberCodec implements TypeCodec<Number> {

    private static final int TAG_NONE = 0;
    private static final int TAG_DOUBLE = 1;
    private static final int TAG_LONG = 2;
    private static final int TAG_BIG = 3;
    // BigInteger holds at most Integer.MAX_VALUE bits
    private static final long MAX_BIG_LENGTH = (Integer.MAX_VALUE / 8) + 1;

    private final String name;

    public NumberCodec(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Number> valueClass() {
        return Number.class;
    }

    @Override
    public Number coerce(Object value) {
        if (value instanceof BigInteger big) {
            return normalize(big);
        }
        if (Coercions.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (Coercions.isFloating(value)) {
            return Coercions.canonicalNaN(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                return normalize(stripped.toBigInteger());
            }
            return decimal.doubleValue();
        }
        throw RejectedValueException.wrongType(name, value);
    }

    static Number normalize(BigInteger value) {
        return value.bitLength() < 64 ? (Number) value.longValue() : value;
    }

    @Override
    public void encode(Number value, ValueOutput out) throws IOException {
        if (value instanceof Double d) {
            out.writeByte(TAG_DOUBLE);
            out.writeLongLE(Double.doubleToLongBits(d));
        }
        else if (value instanceof BigInteger big) {
            byte[] bytes = big.toByteArray();
            out.writeByte(TAG_BIG);
            out.writeVarint(bytes.length);
            out.write(bytes);
        }
        else {
            out.writeByte(TAG_LONG);
            out.writeLongLE(value.longValue());
        }
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        out.writeByte(TAG_NONE);
    }

    @Override
    public Number decode(ValueInput in) throws IOException {
        int tag = in.readByte();
        return switch (tag) {
            case TAG_NONE -> null;
            case TAG_DOUBLE -> Double.longBitsToDouble(in.readLongLE());
            case TAG_LONG -> in.readLongLE();
            case TAG_BIG -> {
                long length = in.readVarint();
                if (length <= 0 || length > MAX_BIG_LENGTH) {
                    throw new IOException("Corrupt number column: bad integer length " + length);
                }
                yield normalize(new BigInteger(in.readBytes((int) length)));
            }
            default -> throw new IOException("Corrupt number column: unknown tag " + tag);
        };
    }

    @Override
    public long hash(Number value) {
        return HashValue.hash(value);
    }

    @Override
    public Comparator<Number> comparator() {
        return NumberOrdering.INSTANCE;
    }

    @Override
    public boolean isOrdered(Number value) {
        return !(value instanceof Double d && d.isNaN());
    }
}
