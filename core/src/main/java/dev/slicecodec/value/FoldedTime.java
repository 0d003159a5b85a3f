/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.value;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A time of day with a fold bit.
 * <p>
 * The fold distinguishes the two occurrences of the same wall-clock reading when clocks are turned
 * back (fold 0 is the earlier one). Precision is one microsecond; finer parts are truncated.
 * </p>
 */
public record FoldedTime(LocalTime time, boolean fold) implements Comparable<FoldedTime> {

    public FoldedTime {
        Objects.requireNonNull(time, "time");
        time = time.truncatedTo(ChronoUnit.MICROS);
    }

    public static FoldedTime of(LocalTime time) {
        return new FoldedTime(time, false);
    }

    public static FoldedTime of(int hour, int minute, int second, int micros, boolean fold) {
        return new FoldedTime(LocalTime.of(hour, minute, second, micros * 1000), fold);
    }

    public int micros() {
        return time.getNano() / 1000;
    }

    @Override
    public int compareTo(FoldedTime other) {
        int result = time.compareTo(other.time);
        return result != 0 ? result : Boolean.compare(fold, other.fold);
    }

    @Override
    public String toString() {
        return fold ? time + "[fold=1]" : time.toString();
    }
}
