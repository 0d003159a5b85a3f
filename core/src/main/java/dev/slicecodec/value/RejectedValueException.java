/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.slicecodec.value;

/**
 * Thrown when a single value cannot be stored in a column of a given type.
 * <p>
 * A rejection concerns only the offending value: the writer that raised it is still usable and
 * nothing has been written for the rejected call. Writers configured with a default value never
 * throw this for {@code write}; they store the default instead.
 * </p>
 */
public class RejectedValueException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        WRONG_TYPE,
        OUT_OF_RANGE,
        UNPARSEABLE,
        NON_ASCII,
        INVALID_UNICODE,
        NONE_NOT_SUPPORTED
    }

    private final Reason reason;
    private final String typeName;

    public RejectedValueException(Reason reason, String typeName, String message) {
        super(typeName + ": " + message);
        this.reason = reason;
        this.typeName = typeName;
    }

    public RejectedValueException(Reason reason, String typeName, String message, Throwable cause) {
        super(typeName + ": " + message, cause);
        this.reason = reason;
        this.typeName = typeName;
    }

    public static RejectedValueException wrongType(String typeName, Object value) {
        return new RejectedValueException(Reason.WRONG_TYPE, typeName,
                "cannot store value of type " + value.getClass().getName());
    }

    public static RejectedValueException outOfRange(String typeName, Object value) {
        return new RejectedValueException(Reason.OUT_OF_RANGE, typeName, "value out of range: " + value);
    }

    public static RejectedValueException unparseable(String typeName, String text) {
        return new RejectedValueException(Reason.UNPARSEABLE, typeName, "cannot parse '" + text + "'");
    }

    public Reason getReason() {
        return reason;
    }

    public String getTypeName() {
        return typeName;
    }
}
