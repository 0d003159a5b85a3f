/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.io.IOException;

import dev.slicecodec.hash.HashValue;
import dev.slicecodec.internal.stream.ValueInput;
import dev.slicecodec.internal.stream.ValueOutput;
import dev.slicecodec.value.Complex;
import dev.slicecodec.value.RejectedValueException;

/**
 * Complex numbers stored as real then imaginary component, in float or double precision.
 * None is the reserved NaN of the component precision in the real part. Complex values are unordered.
 */
public final class ComplexCodec implements TypeCodec<Complex> {

    private final String name;
    private final boolean singlePrecision;

    public ComplexCodec(String name, boolean singlePrecision) {
        this.name = name;
        this.singlePrecision = singlePrecision;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<Complex> valueClass() {
        return Complex.class;
    }

    @Override
    public Complex coerce(Object value) {
        Complex complex;
        if (value instanceof Complex c) {
            complex = c;
        }
        else if (value instanceof Number) {
            complex = Complex.ofReal(Coercions.toDouble(name, value));
        }
        else {
            throw RejectedValueException.wrongType(name, value);
        }
        return singlePrecision ? complex.toFloatPrecision() : complex;
    }

    @Override
    public void encode(Complex value, ValueOutput out) throws IOException {
        if (singlePrecision) {
            out.writeIntLE(Float.floatToIntBits((float) value.real()));
            out.writeIntLE(Float.floatToIntBits((float) value.imag()));
        }
        else {
            out.writeLongLE(Double.doubleToLongBits(value.real()));
            out.writeLongLE(Double.doubleToLongBits(value.imag()));
        }
    }

    @Override
    public void encodeNone(ValueOutput out) throws IOException {
        if (singlePrecision) {
            out.writeIntLE(Float32Codec.NONE_BITS);
            out.writeIntLE(0);
        }
        else {
            out.writeLongLE(Float64Codec.NONE_BITS);
            out.writeLongLE(0L);
        }
    }

    @Override
    public Complex decode(ValueInput in) throws IOException {
        if (singlePrecision) {
            int real = in.readIntLE();
            int imag = in.readIntLE();
            if (real == Float32Codec.NONE_BITS) {
                return null;
            }
            return new Complex(Float.intBitsToFloat(real), Float.intBitsToFloat(imag));
        }
        long real = in.readLongLE();
        long imag = in.readLongLE();
        if (real == Float64Codec.NONE_BITS) {
            return null;
        }
        return new Complex(Double.longBitsToDouble(real), Double.longBitsToDouble(imag));
    }

    @Override
    public long hash(Complex value) {
        return HashValue.hashComplex(value.real(), value.imag());
    }
}
