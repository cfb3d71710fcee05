// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

/**
 * Classifies the failures reported by this library.
 *
 * @see CivilTimeException#getKind()
 * @see InvalidInstantException#getKind()
 */
public enum ErrorKind
{
    /** A calendar field is out of range, or the day does not exist. */
    INVALID_DATE,

    /** An hour, minute or second field is out of range. */
    INVALID_TIME_OF_DAY,

    /** A local offset has out-of-range fields or a negative zero sign. */
    INVALID_ZONE_OFFSET,

    /** A second of 60 or more on a day that cannot hold a leap second. */
    INVALID_LEAP_SECOND,

    /** An epoch day, instant or year outside of 0000-01-01 to 9999-12-31. */
    OUT_OF_RANGE,

    /** Text that does not match the timestamp grammar. */
    MALFORMED_TIMESTAMP,

    /** An instant whose fields have no corresponding timestamp. */
    INVALID_INSTANT,
}
