/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.metadata;

/**
 * Attributes of a finished column file, as computed by the writer.
 *
 * @param type the column type
 * @param noneSupport whether the column may contain None
 * @param compression block compression of the file
 * @param count number of values written, substituted defaults included
 * @param min smallest ordered value, or null if the type is unordered or no value qualified
 * @param max largest ordered value, or null likewise
 * @param <T> the Java type of the values
 */
public record ColumnFileInfo<T>(
        ColumnType<T> type,
        boolean noneSupport,
        Compression compression,
        long count,
        T min,
        T max) {
}
