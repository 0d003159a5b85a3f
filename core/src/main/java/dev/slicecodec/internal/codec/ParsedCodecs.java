/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.internal.codec;

import java.time.LocalDate;

import dev.slicecodec.value.Complex;
import dev.slicecodec.value.FoldedDateTime;
import dev.slicecodec.value.FoldedTime;

/**
 * Factories for the {@code parsed:} variants of the base codecs.
 */
public final class ParsedCodecs {

    private ParsedCodecs() {
    }

    public static ParsedCodec<Integer> int32() {
        Int32Codec base = new Int32Codec("int32");
        return new ParsedCodec<>(base, text -> TextParsers.parseInteger("parsed:int32", text),
                ParsedCodec.truncatingFloats("parsed:int32"));
    }

    public static ParsedCodec<Long> int64() {
        Int64Codec base = new Int64Codec("int64");
        return new ParsedCodec<>(base, text -> TextParsers.parseInteger("parsed:int64", text),
                ParsedCodec.truncatingFloats("parsed:int64"));
    }

    public static ParsedCodec<Float> float32() {
        return new ParsedCodec<>(new Float32Codec("float32"), text -> TextParsers.parseFloat("parsed:float32", text));
    }

    public static ParsedCodec<Double> float64() {
        return new ParsedCodec<>(new Float64Codec("float64"), text -> TextParsers.parseFloat("parsed:float64", text));
    }

    public static ParsedCodec<Complex> complex32() {
        return new ParsedCodec<>(new ComplexCodec("complex32", true),
                text -> TextParsers.parseComplex("parsed:complex32", text));
    }

    public static ParsedCodec<Complex> complex64() {
        return new ParsedCodec<>(new ComplexCodec("complex64", false),
                text -> TextParsers.parseComplex("parsed:complex64", text));
    }

    public static ParsedCodec<Number> number() {
        return new ParsedCodec<>(new NumberCodec("number"), text -> TextParsers.parseNumber("parsed:number", text));
    }

    public static ParsedCodec<LocalDate> date() {
        return new ParsedCodec<>(new DateCodec("date"), text -> TextParsers.parseDate("parsed:date", text));
    }

    public static ParsedCodec<FoldedTime> time() {
        return new ParsedCodec<>(new TimeCodec("time"), text -> TextParsers.parseTime("parsed:time", text));
    }

    public static ParsedCodec<FoldedDateTime> dateTime() {
        return new ParsedCodec<>(new DateTimeCodec("datetime"),
                text -> TextParsers.parseDateTime("parsed:datetime", text));
    }

    public static ParsedCodec<Object> json() {
        JsonCodec base = new JsonCodec("json");
        return new ParsedCodec<>(base, base::parse);
    }
}
