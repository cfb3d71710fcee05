// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

/**
 * Signals an attempt to create a {@link Timestamp} from an {@link Instant} or
 * from an epoch-seconds value that has no corresponding timestamp.
 * <p>
 * This is a programming error rather than bad input, so it is intentionally
 * not a {@link CivilTimeException}: code that handles untrusted text by
 * catching {@code CivilTimeException} will not mask it.
 *
 * @see Timestamp#fromInstant(Instant)
 * @see Timestamp#fromEpochSeconds(java.math.BigDecimal)
 */
public class InvalidInstantException extends IllegalArgumentException
{
    private static final long serialVersionUID = 6049152783372364012L;

    private final ErrorKind myKind;

    public InvalidInstantException(ErrorKind kind, String message)
    {
        super(message);
        myKind = kind;
    }

    public InvalidInstantException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        myKind = kind;
    }

    /**
     * Gets the classification of this failure; one of
     * {@link ErrorKind#INVALID_INSTANT}, {@link ErrorKind#INVALID_LEAP_SECOND}
     * or {@link ErrorKind#OUT_OF_RANGE}.
     */
    public ErrorKind getKind()
    {
        return myKind;
    }
}
