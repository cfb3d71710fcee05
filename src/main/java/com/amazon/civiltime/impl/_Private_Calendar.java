// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.impl;

import com.amazon.civiltime.CivilTimeException;
import com.amazon.civiltime.Date;
import com.amazon.civiltime.ErrorKind;

/**
 * Proleptic Gregorian calendar arithmetic over the years 0 through 9999.
 * Days are counted from the epoch 2000-01-01, which is day zero.
 * <p>
 * The conversions use the closed-form days-from-civil formulation: the year
 * is shifted to begin on March 1 so that the leap day falls at the end, and
 * days are grouped into 400 year eras of exactly 146097 days.
 *
 * <b>This class is not intended for general use.</b>
 */
public final class _Private_Calendar
{
    private _Private_Calendar() { }

    public static final int MIN_YEAR = 0;
    public static final int MAX_YEAR = 9999;

    /** 0000-01-01 as an epoch day. */
    public static final int MIN_EPOCH_DAY = -730485;

    /** 9999-12-31 as an epoch day. */
    public static final int MAX_EPOCH_DAY = 2921939;

    public static final int SECONDS_PER_DAY = 86400;
    public static final int MINUTES_PER_DAY = 1440;

    private static final int DAYS_PER_ERA = 146097;

    /** Days from 0000-03-01 to 2000-01-01. */
    private static final int EPOCH_SHIFT = 730425;

                                                      //   jan, feb, mar, apr, may, jun, jul, aug, sep, oct, nov, dec
                                                      // the first 0 is to make these arrays 1 based (since month values are 1-12)
    private static final int[] LEAP_DAYS_IN_MONTH   = { 0,  31,  29,  31,  30,  31,  30,  31,  31,  30,  31,  30,  31 };
    private static final int[] NORMAL_DAYS_IN_MONTH = { 0,  31,  28,  31,  30,  31,  30,  31,  31,  30,  31,  30,  31 };


    public static boolean isLeapYear(int year)
    {
        if ((year % 4) != 0) return false;
        // centuries are leap years only when divisible by 400
        if ((year % 100) != 0) return true;
        return (year % 400) == 0;
    }

    /**
     * @param month must be 1 through 12.
     */
    public static int lastDayOfMonth(int year, int month)
    {
        return isLeapYear(year) ? LEAP_DAYS_IN_MONTH[month] : NORMAL_DAYS_IN_MONTH[month];
    }

    public static boolean isSupportedEpochDay(long epochDays)
    {
        return MIN_EPOCH_DAY <= epochDays && epochDays <= MAX_EPOCH_DAY;
    }

    /**
     * @throws CivilTimeException with {@link ErrorKind#INVALID_DATE} if the
     * fields do not name an existing day in years 0 through 9999.
     */
    public static void checkDate(int year, int month, int day)
    {
        if (year < MIN_YEAR || year > MAX_YEAR)
        {
            throw new CivilTimeException(ErrorKind.INVALID_DATE,
                String.format("Year %s must be between %s and %s inclusive", year, MIN_YEAR, MAX_YEAR));
        }
        if (month < 1 || month > 12)
        {
            throw new CivilTimeException(ErrorKind.INVALID_DATE,
                String.format("Month %s must be between 1 and 12 inclusive", month));
        }
        int lastDayInMonth = lastDayOfMonth(year, month);
        if (day < 1 || day > lastDayInMonth)
        {
            throw new CivilTimeException(ErrorKind.INVALID_DATE,
                String.format("Day %s for year %s and month %s must be between 1 and %s inclusive",
                              day, year, month, lastDayInMonth));
        }
    }

    /**
     * Counts the days from 2000-01-01 to the given date.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_DATE} if the
     * fields do not name an existing day.
     */
    public static int daysFromDate(int year, int month, int day)
    {
        checkDate(year, month, day);

        // January and February belong to the previous March-based year.
        int y = (month <= 2) ? year - 1 : year;
        int era = Math.floorDiv(y, 400);
        int yearOfEra = y - era * 400;                                        // [0, 399]
        int dayOfYear = (153 * (month > 2 ? month - 3 : month + 9) + 2) / 5
                        + day - 1;                                            // [0, 365]
        int dayOfEra = yearOfEra * 365 + yearOfEra / 4 - yearOfEra / 100
                       + dayOfYear;                                           // [0, 146096]
        return era * DAYS_PER_ERA + dayOfEra - EPOCH_SHIFT;
    }

    /**
     * The inverse of {@link #daysFromDate(int, int, int)}.
     *
     * @throws CivilTimeException with {@link ErrorKind#OUT_OF_RANGE} if the
     * day falls outside of years 0 through 9999.
     */
    public static Date dateFromDays(int epochDays)
    {
        if (!isSupportedEpochDay(epochDays))
        {
            throw new CivilTimeException(ErrorKind.OUT_OF_RANGE,
                String.format("Epoch day %s must be between %s (0000-01-01) and %s (9999-12-31) inclusive",
                              epochDays, MIN_EPOCH_DAY, MAX_EPOCH_DAY));
        }

        int z = epochDays + EPOCH_SHIFT;
        int era = Math.floorDiv(z, DAYS_PER_ERA);
        int dayOfEra = z - era * DAYS_PER_ERA;                                // [0, 146096]
        int yearOfEra = (dayOfEra - dayOfEra / 1460 + dayOfEra / 36524
                         - dayOfEra / 146096) / 365;                          // [0, 399]
        int dayOfYear = dayOfEra - (365 * yearOfEra + yearOfEra / 4
                                    - yearOfEra / 100);                       // [0, 365]
        int shiftedMonth = (5 * dayOfYear + 2) / 153;                         // [0, 11]
        int day = dayOfYear - (153 * shiftedMonth + 2) / 5 + 1;               // [1, 31]
        int month = shiftedMonth < 10 ? shiftedMonth + 3 : shiftedMonth - 9;  // [1, 12]
        int year = yearOfEra + era * 400 + (month <= 2 ? 1 : 0);
        return Date.of(year, month, day);
    }
}
