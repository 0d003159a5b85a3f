/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.config;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.slicecodec.hash.HashFilter;
import dev.slicecodec.metadata.Compression;

/**
 * Conversion of loosely typed option maps into option values.
 * All failures are {@link IllegalArgumentException}s naming the offending option.
 */
public final class OptionValues {

    private OptionValues() {
    }

    public static void checkKnownKeys(Map<String, ?> options, Set<String> knownKeys) {
        for (String key : options.keySet()) {
            if (!knownKeys.contains(key)) {
                throw new IllegalArgumentException("Unknown option '" + key + "', expected one of " + knownKeys);
            }
        }
    }

    public static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw wrongType(key, value, "a boolean");
    }

    public static long asLong(String key, Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        throw wrongType(key, value, "an integer");
    }

    public static int asInt(String key, Object value) {
        long v = asLong(key, value);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Option '" + key + "' out of range: " + v);
        }
        return (int) v;
    }

    /**
     * A {@link Compression} or its scheme name; null stays null.
     */
    public static Compression asCompression(String key, Object value) {
        if (value == null || value instanceof Compression) {
            return (Compression) value;
        }
        if (value instanceof String name) {
            return Compression.fromName(name);
        }
        throw wrongType(key, value, "a compression name");
    }

    /**
     * A {@link HashFilter}, or a list {@code [sliceno, slices]} or {@code [sliceno, slices, spreadNone]};
     * null stays null.
     */
    public static HashFilter asHashFilter(String key, Object value) {
        if (value == null || value instanceof HashFilter) {
            return (HashFilter) value;
        }
        if (value instanceof List<?> list && (list.size() == 2 || list.size() == 3)) {
            int sliceno = asInt(key, list.get(0));
            int slices = asInt(key, list.get(1));
            boolean spreadNone = list.size() == 3 && asBoolean(key, list.get(2));
            return new HashFilter(sliceno, slices, spreadNone);
        }
        throw wrongType(key, value, "a HashFilter or [sliceno, slices[, spread_none]]");
    }

    private static IllegalArgumentException wrongType(String key, Object value, String expected) {
        String actual = value == null ? "null" : value.getClass().getName();
        return new IllegalArgumentException("Option '" + key + "' must be " + expected + ", got " + actual);
    }
}
