/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.hash;

/**
 * Restriction of a column to one slice out of {@code slices}.
 * <p>
 * A value belongs to slice {@code hash % slices} (unsigned). With {@code spreadNone}, None values
 * are not hashed but all go to the last slice; without it they hash to 0 and land in slice 0.
 * </p>
 *
 * @param sliceno the slice to keep
 * @param slices the total number of slices
 * @param spreadNone whether None values are routed to the last slice
 */
public record HashFilter(int sliceno, int slices, boolean spreadNone) {

    public HashFilter {
        if (slices <= 0) {
            throw new IllegalArgumentException("slices must be positive, got " + slices);
        }
        if (sliceno < 0 || sliceno >= slices) {
            throw new IllegalArgumentException("sliceno " + sliceno + " out of range for " + slices + " slices");
        }
    }

    public static HashFilter of(int sliceno, int slices) {
        return new HashFilter(sliceno, slices, false);
    }

    /**
     * The slice a non-None value with the given hash belongs to.
     */
    public int sliceOf(long hash) {
        return (int) Long.remainderUnsigned(hash, slices);
    }

    /**
     * The slice None values belong to.
     */
    public int noneSlice() {
        return spreadNone ? slices - 1 : 0;
    }

    public boolean routes(long hash) {
        return sliceOf(hash) == sliceno;
    }

    public boolean routesNone() {
        return noneSlice() == sliceno;
    }
}
