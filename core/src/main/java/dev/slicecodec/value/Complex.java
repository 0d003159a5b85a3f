/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.value;

/**
 * A complex number with double precision components.
 * <p>
 * {@code complex32} columns store the components with float precision; values read back from
 * such a column have components that are exactly representable as floats.
 * </p>
 */
public record Complex(double real, double imag) {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    /**
     * Returns this value with both components rounded to float precision.
     */
    public Complex toFloatPrecision() {
        return new Complex((float) real, (float) imag);
    }

    public boolean isZero() {
        return real == 0.0 && imag == 0.0;
    }

    @Override
    public String toString() {
        return "(" + real + (imag < 0 || Double.isNaN(imag) ? "" : "+") + imag + "j)";
    }
}
