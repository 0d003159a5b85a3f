/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.slicecodec.value.Complex;
import dev.slicecodec.value.RejectedValueException;

/**
 * Parsing of trimmed text into base type values for the {@code parsed:} column types.
 */
final class TextParsers {

    private static final String UNSIGNED_FLOAT = "(?:(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?|(?i:inf(?:inity)?|nan))";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?" + UNSIGNED_FLOAT);
    private static final Pattern IMAGINARY = Pattern.compile("([+-]?" + UNSIGNED_FLOAT + "?)[jJ]");
    private static final Pattern REAL_AND_IMAGINARY = Pattern.compile(
            "([+-]?" + UNSIGNED_FLOAT + ")([+-]" + UNSIGNED_FLOAT + "?)[jJ]");

    private TextParsers() {
    }

    static BigInteger parseInteger(String typeName, String text) {
        if (!INTEGER.matcher(text).matches()) {
            throw RejectedValueException.unparseable(typeName, text);
        }
        return new BigInteger(text.startsWith("+") ? text.substring(1) : text);
    }

    static double parseFloat(String typeName, String text) {
        if (!FLOAT.matcher(text).matches()) {
            throw RejectedValueException.unparseable(typeName, text);
        }
        return toDouble(text);
    }

    /**
     * Integer text becomes an integer of any magnitude, other numeric text a double.
     */
    static Number parseNumber(String typeName, String text) {
        if (INTEGER.matcher(text).matches()) {
            return NumberCodec.normalize(parseInteger(typeName, text));
        }
        return Coercions.canonicalNaN(parseFloat(typeName, text));
    }

    static Complex parseComplex(String typeName, String text) {
        String body = text;
        if (body.startsWith("(") && body.endsWith(")")) {
            body = body.substring(1, body.length() - 1).strip();
        }
        if (FLOAT.matcher(body).matches()) {
            return Complex.ofReal(toDouble(body));
        }
        Matcher imaginary = IMAGINARY.matcher(body);
        if (imaginary.matches()) {
            return new Complex(0.0, imaginaryPart(imaginary.group(1)));
        }
        Matcher both = REAL_AND_IMAGINARY.matcher(body);
        if (both.matches()) {
            return new Complex(toDouble(both.group(1)), imaginaryPart(both.group(2)));
        }
        throw RejectedValueException.unparseable(typeName, text);
    }

    static LocalDate parseDate(String typeName, String text) {
        try {
            return LocalDate.parse(text);
        }
        catch (DateTimeParseException e) {
            throw unparseable(typeName, text, e);
        }
    }

    static LocalTime parseTime(String typeName, String text) {
        try {
            return LocalTime.parse(text);
        }
        catch (DateTimeParseException e) {
            throw unparseable(typeName, text, e);
        }
    }

    static LocalDateTime parseDateTime(String typeName, String text) {
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            return LocalDateTime.parse(iso);
        }
        catch (DateTimeParseException e) {
            throw unparseable(typeName, text, e);
        }
    }

    private static RejectedValueException unparseable(String typeName, String text, Exception cause) {
        return new RejectedValueException(RejectedValueException.Reason.UNPARSEABLE, typeName,
                "cannot parse '" + text + "'", cause);
    }

    // "", "+" and "-" stand for a unit imaginary part
    private static double imaginaryPart(String text) {
        if (text.isEmpty() || text.equals("+")) {
            return 1.0;
        }
        if (text.equals("-")) {
            return -1.0;
        }
        return toDouble(text);
    }

    private static double toDouble(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(text);
    }
}
