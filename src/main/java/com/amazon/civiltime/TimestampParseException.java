// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

/**
 * Thrown when text cannot be read as a {@link Timestamp}, either because it
 * doesn't match the grammar ({@link ErrorKind#MALFORMED_TIMESTAMP}) or
 * because its fields describe a date, time or offset that doesn't exist.
 */
public class TimestampParseException extends CivilTimeException
{
    private static final long serialVersionUID = 1740436327718265906L;

    private final int myPosition;

    public TimestampParseException(ErrorKind kind, String message, int position)
    {
        super(kind, message);
        myPosition = position;
    }

    public TimestampParseException(ErrorKind kind, String message, int position,
                                   Throwable cause)
    {
        super(kind, message, cause);
        myPosition = position;
    }

    /**
     * Gets the zero-based index of the character at which the failure was
     * detected. For field values that are out of range this is the start of
     * the offending field.
     */
    public int getPosition()
    {
        return myPosition;
    }
}
