/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.value;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A local date-time with a fold bit, see {@link FoldedTime} for the meaning of the fold.
 * Precision is one microsecond.
 */
public record FoldedDateTime(LocalDateTime dateTime, boolean fold) implements Comparable<FoldedDateTime> {

    public FoldedDateTime {
        Objects.requireNonNull(dateTime, "dateTime");
        dateTime = dateTime.truncatedTo(ChronoUnit.MICROS);
    }

    public static FoldedDateTime of(LocalDateTime dateTime) {
        return new FoldedDateTime(dateTime, false);
    }

    public int micros() {
        return dateTime.getNano() / 1000;
    }

    @Override
    public int compareTo(FoldedDateTime other) {
        int result = dateTime.compareTo(other.dateTime);
        return result != 0 ? result : Boolean.compare(fold, other.fold);
    }

    @Override
    public String toString() {
        return fold ? dateTime + "[fold=1]" : dateTime.toString();
    }
}
