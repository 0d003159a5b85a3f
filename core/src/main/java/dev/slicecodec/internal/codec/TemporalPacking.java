/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;

/**
 * Bit packing of temporal values into the integers stored in column files.
 * <p>
 * Dates pack as {@code year << 9 | month << 5 | day}. Times pack hour, minute, second, microsecond
 * and fold, in that order from the most significant bits; date-times prepend year, month and day.
 * All packed values are non-negative, leaving {@code -1} free as the None marker.
 * </p>
 */
public final class TemporalPacking {

    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    private static final long FOLD_BIT = 1L;

    private TemporalPacking() {
    }

    public static boolean isSupportedYear(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    public static int packDate(LocalDate date) {
        return (date.getYear() << 9) | (date.getMonthValue() << 5) | date.getDayOfMonth();
    }

    public static LocalDate unpackDate(int packed) {
        return LocalDate.of(packed >>> 9, (packed >>> 5) & 0x0F, packed & 0x1F);
    }

    public static long packTime(FoldedTime time) {
        return packClock(time.time(), time.micros(), time.fold());
    }

    public static FoldedTime unpackTime(long packed) {
        return new FoldedTime(unpackClock(packed), (packed & FOLD_BIT) != 0);
    }

    public static long packDateTime(FoldedDateTime dateTime) {
        LocalDateTime value = dateTime.dateTime();
        long date = ((long) value.getYear() * 16 + value.getMonthValue()) * 32 + value.getDayOfMonth();
        return (date << 38) | packClock(value.toLocalTime(), dateTime.micros(), dateTime.fold());
    }

    public static FoldedDateTime unpackDateTime(long packed) {
        long date = packed >>> 38;
        LocalDate localDate = LocalDate.of((int) (date >>> 9), (int) ((date >>> 5) & 0x0F), (int) (date & 0x1F));
        return new FoldedDateTime(LocalDateTime.of(localDate, unpackClock(packed)), (packed & FOLD_BIT) != 0);
    }

    /**
     * The packed form with the fold cleared, so both readings of an ambiguous wall clock hash alike.
     */
    public static long withoutFold(long packed) {
        return packed & ~FOLD_BIT;
    }

    // hour (5 bits) | minute (6) | second (6) | micros (20) | fold (1)
    private static long packClock(LocalTime time, int micros, boolean fold) {
        long clock = ((long) time.getHour() * 64 + time.getMinute()) * 64 + time.getSecond();
        return (((clock << 20) | micros) << 1) | (fold ? FOLD_BIT : 0);
    }

    private static LocalTime unpackClock(long packed) {
        int micros = (int) ((packed >>> 1) & 0xFFFFF);
        long clock = (packed >>> 21) & 0x1FFFF;
        int second = (int) (clock & 0x3F);
        int minute = (int) ((clock >>> 6) & 0x3F);
        int hour = (int) ((clock >>> 12) & 0x1F);
        return LocalTime.of(hour, minute, second, micros * 1000);
    }
}
