// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import com.amazon.civiltime.impl._Private_Calendar;

/**
 * An immutable calendar day in the proleptic Gregorian calendar, between
 * 0000-01-01 and 9999-12-31. Year 0 is the year 1 BC.
 * <p>
 * A {@code Date} carries no time zone; whether it denotes a UTC or a local day
 * depends on where it came from.
 *
 * @see Timestamp#getUtcDate()
 * @see Timestamp#getLocalDate()
 */
public final class Date
    implements Comparable<Date>
{
    private final short _year;
    private final byte  _month;
    private final byte  _day;

    private Date(int year, int month, int day)
    {
        _year  = (short) year;
        _month = (byte) month;
        _day   = (byte) day;
    }

    /**
     * @param year 0 through 9999.
     * @param month 1 through 12.
     * @param day 1 through the last day of the month.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_DATE} if the
     * fields do not name an existing day.
     */
    public static Date of(int year, int month, int day)
    {
        _Private_Calendar.checkDate(year, month, day);
        return new Date(year, month, day);
    }

    /**
     * Returns the day that is the given number of days from 2000-01-01.
     *
     * @throws CivilTimeException with {@link ErrorKind#OUT_OF_RANGE} if the
     * result would be outside of years 0 through 9999.
     *
     * @see #toEpochDays()
     */
    public static Date fromEpochDays(int epochDays)
    {
        return _Private_Calendar.dateFromDays(epochDays);
    }

    /**
     * Counts the days from 2000-01-01 to the given fields, which need not form
     * a {@code Date} yet.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_DATE} if the
     * fields do not name an existing day; for example 1900-02-29.
     */
    public static int daysFromDate(int year, int month, int day)
    {
        return _Private_Calendar.daysFromDate(year, month, day);
    }

    /**
     * Returns true if the year has a February 29.
     */
    public static boolean isLeapYear(int year)
    {
        return _Private_Calendar.isLeapYear(year);
    }

    /**
     * @param month 1 through 12.
     */
    public static int lastDayOfMonth(int year, int month)
    {
        if (month < 1 || month > 12)
        {
            throw new CivilTimeException(ErrorKind.INVALID_DATE,
                String.format("Month %s must be between 1 and 12 inclusive", month));
        }
        return _Private_Calendar.lastDayOfMonth(year, month);
    }


    public int getYear()
    {
        return _year;
    }

    /** @return 1 through 12. */
    public int getMonth()
    {
        return _month;
    }

    public int getDay()
    {
        return _day;
    }

    /**
     * Counts the days from 2000-01-01 to this date; negative for earlier dates.
     */
    public int toEpochDays()
    {
        return _Private_Calendar.daysFromDate(_year, _month, _day);
    }

    public boolean isLastDayOfMonth()
    {
        return _day == _Private_Calendar.lastDayOfMonth(_year, _month);
    }


    public int compareTo(Date other)
    {
        int result = Integer.compare(_year, other._year);
        if (result != 0) return result;
        result = Integer.compare(_month, other._month);
        if (result != 0) return result;
        return Integer.compare(_day, other._day);
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof Date)) return false;
        Date that = (Date) other;
        return _year == that._year && _month == that._month && _day == that._day;
    }

    @Override
    public int hashCode()
    {
        return (_year * 12 + _month) * 31 + _day;
    }

    /**
     * Returns the date in {@code yyyy-mm-dd} form.
     */
    @Override
    public String toString()
    {
        return String.format("%04d-%02d-%02d", _year, _month, _day);
    }
}
