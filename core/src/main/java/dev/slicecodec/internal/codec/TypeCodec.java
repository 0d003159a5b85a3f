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

import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.RejectedValueException;

/**
 * Encoding, decoding, hashing and ordering of the values of one logical column type.
 * <p>
 * Codecs are stateless and shared. {@link #coerce} is the single place where input values are
 * validated; everything downstream works on coerced values only, so {@link #encode} cannot fail
 * for reasons other than I/O.
 * </p>
 *
 * @param <T> the Java type of the values
 */
public interface TypeCodec<T> {

    String name();

    Class<T> valueClass();

    /**
     * Convert an input value to this type's canonical representation.
     *
     * @param value a non-null input value
     * @return the value to store
     * @throws RejectedValueException if the value is of the wrong type, out of range or unparseable
     */
    T coerce(Object value);

    default boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        try {
            coerce(value);
            return true;
        }
        catch (RejectedValueException e) {
            return false;
        }
    }

    void encode(T value, ValueOutput out) throws IOException;

    /**
     * Write the marker this type uses for None.
     */
    void encodeNone(ValueOutput out) throws IOException;

    /**
     * Decode the next value.
     *
     * @return the value, or null if the None marker was read
     */
    T decode(ValueInput in) throws IOException;

    /**
     * The slicing hash of a coerced value.
     */
    long hash(T value);

    /**
     * Natural ordering used for min/max, or null if this type has none.
     */
    default Comparator<? super T> comparator() {
        return null;
    }

    /**
     * Whether the value takes part in min/max. NaN does not.
     */
    default boolean isOrdered(T value) {
        return true;
    }
}
