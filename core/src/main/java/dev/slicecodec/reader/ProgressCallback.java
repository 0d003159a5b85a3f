/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.reader;

/**
 * Notified by a {@link ColumnReader} every time the number of values it returned reaches a multiple
 * of the configured interval.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param lines values returned so far, plus the configured offset
     * @return {@link CallbackAction#STOP} to end iteration cleanly
     */
    CallbackAction onProgress(long lines);
}
