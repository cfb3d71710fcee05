// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.impl;

import com.amazon.civiltime.CivilTimeException;
import com.amazon.civiltime.Date;
import com.amazon.civiltime.ErrorKind;
import java.math.BigDecimal;

/**
 * The positive leap second rules. A UTC day may run past 86400 seconds, by
 * less than one second, only when it is the last day of a month in 1972 or
 * later. Negative leap seconds are not modeled.
 *
 * <b>This class is not intended for general use.</b>
 */
public final class _Private_LeapSeconds
{
    private _Private_LeapSeconds() { }

    /** The first year in which UTC inserted a leap second. */
    public static final int FIRST_LEAP_SECOND_YEAR = 1972;

    public static final BigDecimal SECONDS_PER_DAY =
        BigDecimal.valueOf(_Private_Calendar.SECONDS_PER_DAY);

    /** Exclusive upper bound of a UTC time of day, leap second included. */
    public static final BigDecimal SECONDS_PER_LEAP_DAY =
        BigDecimal.valueOf(_Private_Calendar.SECONDS_PER_DAY + 1);


    /**
     * Determines whether the given UTC day may end with a positive leap
     * second.
     *
     * @throws CivilTimeException with {@link ErrorKind#OUT_OF_RANGE} if the
     * day is not supported.
     */
    public static boolean isLeapSecondDay(int epochDays)
    {
        Date date = _Private_Calendar.dateFromDays(epochDays);
        return date.getYear() >= FIRST_LEAP_SECOND_YEAR
            && date.getDay() == _Private_Calendar.lastDayOfMonth(date.getYear(), date.getMonth());
    }

    /**
     * @param utcTimeOfDaySeconds must not be null.
     */
    public static boolean isLeapSecond(BigDecimal utcTimeOfDaySeconds)
    {
        return utcTimeOfDaySeconds.compareTo(SECONDS_PER_DAY) >= 0;
    }

    /**
     * Validates a UTC time of day against the day it belongs to.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_INSTANT} if
     * the value is outside of [0, 86401), with
     * {@link ErrorKind#INVALID_LEAP_SECOND} if it reaches 86400 on a day
     * without a leap second, or with {@link ErrorKind#OUT_OF_RANGE} if the
     * day is not supported.
     */
    public static void checkUtcTimeOfDaySeconds(int epochDays, BigDecimal utcTimeOfDaySeconds)
    {
        if (utcTimeOfDaySeconds.signum() < 0
            || utcTimeOfDaySeconds.compareTo(SECONDS_PER_LEAP_DAY) >= 0)
        {
            throw new CivilTimeException(ErrorKind.INVALID_INSTANT,
                "UTC time of day " + utcTimeOfDaySeconds.toPlainString()
                + " must be greater than or equal to 0 and less than 86401");
        }
        if (isLeapSecond(utcTimeOfDaySeconds) && !isLeapSecondDay(epochDays))
        {
            throw new CivilTimeException(ErrorKind.INVALID_LEAP_SECOND,
                "UTC time of day " + utcTimeOfDaySeconds.toPlainString()
                + " is a leap second, but " + _Private_Calendar.dateFromDays(epochDays)
                + " is not the last day of a month in " + FIRST_LEAP_SECOND_YEAR + " or later");
        }
    }

    /**
     * Removes a partial leap second. A value of 86400 or more becomes the
     * greatest value below 86400 with the same number of fractional digits,
     * so {@code 86400.25} becomes {@code 86399.99} and {@code 86400} becomes
     * {@code 86399}. Smaller values are returned unchanged.
     *
     * @param utcTimeOfDaySeconds must not be null.
     */
    public static BigDecimal clamp(BigDecimal utcTimeOfDaySeconds)
    {
        if (!isLeapSecond(utcTimeOfDaySeconds)) return utcTimeOfDaySeconds;

        int scale = Math.max(utcTimeOfDaySeconds.scale(), 0);
        BigDecimal unit = BigDecimal.ONE.movePointLeft(scale);
        return SECONDS_PER_DAY.setScale(scale).subtract(unit);
    }
}
