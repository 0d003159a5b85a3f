/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.reader;

/**
 * Lifecycle of a {@link ColumnReader}. Once iteration has ended it never resumes.
 */
public enum ReaderState {
    OPENED,
    ITERATING,
    EXHAUSTED,
    STOPPED_BY_CALLBACK,
    ABORTED,
    CLOSED;

    public boolean isTerminal() {
        return this != OPENED && this != ITERATING;
    }
}
