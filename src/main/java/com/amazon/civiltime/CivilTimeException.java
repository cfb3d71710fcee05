// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

/**
 * Base class for the recoverable exceptions thrown throughout this library.
 * These signal bad input, for example a nonexistent calendar day or text that
 * is not a timestamp.
 * <p>
 * Violations of the invariants of an {@link Instant} are not recoverable and
 * are reported by {@link InvalidInstantException} instead.
 */
public class CivilTimeException extends RuntimeException
{
    private static final long serialVersionUID = -3312847045106337105L;

    private final ErrorKind myKind;

    public CivilTimeException(ErrorKind kind, String message)
    {
        super(message);
        myKind = kind;
    }

    public CivilTimeException(ErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        myKind = kind;
    }

    /**
     * Gets the classification of this failure.
     *
     * @return not null.
     */
    public ErrorKind getKind()
    {
        return myKind;
    }
}
