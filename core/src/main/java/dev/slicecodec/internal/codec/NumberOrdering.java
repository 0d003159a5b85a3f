/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Exact ordering of mixed {@code Long}, {@code BigInteger} and {@code Double} values.
 * NaN is never compared; callers exclude it first.
 */
final class NumberOrdering implements Comparator<Number> {

    static final NumberOrdering INSTANCE = new NumberOrdering();

    private NumberOrdering() {
    }

    @Override
    public int compare(Number a, Number b) {
        if (a instanceof Long x && b instanceof Long y) {
            return Long.compare(x, y);
        }
        if (a instanceof Double x && b instanceof Double y) {
            return Double.compare(x, y);
        }
        if (isInfinite(a) || isInfinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isInfinite(Number n) {
        return n instanceof Double d && d.isInfinite();
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof Double d) {
            return new BigDecimal(d);
        }
        if (n instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
