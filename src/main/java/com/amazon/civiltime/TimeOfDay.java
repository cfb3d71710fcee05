// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import java.math.BigDecimal;

/**
 * An immutable wall-clock time within a day, with exact decimal seconds.
 * <p>
 * The second may be in [60, 61) to denote a positive leap second. Whether
 * such a value is legal depends on the UTC day it falls on, which is checked
 * when it is combined with a {@link Date} by
 * {@link Timestamp#fromLocalDateTimeOffset}.
 */
public final class TimeOfDay
{
    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);
    private static final BigDecimal SIXTY_ONE = BigDecimal.valueOf(61);

    /** 00:00:00 */
    public static final TimeOfDay MIDNIGHT = new TimeOfDay(0, 0, BigDecimal.ZERO);

    private final byte       _hour;
    private final byte       _minute;
    private final BigDecimal _second;

    private TimeOfDay(int hour, int minute, BigDecimal second)
    {
        _hour   = (byte) hour;
        _minute = (byte) minute;
        _second = second;
    }

    /**
     * @param hour 0 through 23.
     * @param minute 0 through 59.
     * @param second at least 0 and less than 61. The scale of the value is
     *  retained as the precision of the time.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_TIME_OF_DAY}
     * if a field is out of range.
     */
    public static TimeOfDay of(int hour, int minute, BigDecimal second)
    {
        if (hour < 0 || hour > 23)
        {
            throw new CivilTimeException(ErrorKind.INVALID_TIME_OF_DAY,
                String.format("Hour %s must be between 0 and 23 inclusive", hour));
        }
        if (minute < 0 || minute > 59)
        {
            throw new CivilTimeException(ErrorKind.INVALID_TIME_OF_DAY,
                String.format("Minute %s must be between 0 and 59 inclusive", minute));
        }
        if (second == null)
        {
            throw new NullPointerException("second");
        }
        if (second.signum() < 0 || second.compareTo(SIXTY_ONE) >= 0)
        {
            throw new CivilTimeException(ErrorKind.INVALID_TIME_OF_DAY,
                String.format("Second %s must be greater than or equal to 0 and less than 61",
                              second.toPlainString()));
        }
        return new TimeOfDay(hour, minute, second);
    }

    public static TimeOfDay of(int hour, int minute, int second)
    {
        return of(hour, minute, BigDecimal.valueOf(second));
    }


    public int getHour()
    {
        return _hour;
    }

    public int getMinute()
    {
        return _minute;
    }

    /**
     * @return not null; at least 0 and less than 61.
     */
    public BigDecimal getSecond()
    {
        return _second;
    }

    /**
     * Returns true if the second is 60 or more.
     */
    public boolean isLeapSecond()
    {
        return _second.compareTo(SIXTY) >= 0;
    }

    /**
     * Returns the seconds elapsed since midnight, counting a leap second past
     * 86399 the way the UTC time of day of an {@link Instant} does.
     */
    public BigDecimal toSecondOfDay()
    {
        return BigDecimal.valueOf(_hour * 3600L + _minute * 60L).add(_second);
    }


    /**
     * Compares hour, minute and second, the latter including its scale.
     */
    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof TimeOfDay)) return false;
        TimeOfDay that = (TimeOfDay) other;
        return _hour == that._hour
            && _minute == that._minute
            && _second.equals(that._second);
    }

    @Override
    public int hashCode()
    {
        return (_hour * 60 + _minute) * 31 + _second.hashCode();
    }

    /**
     * Returns the time in {@code hh:mm:ss[.fff]} form.
     */
    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(16);
        buffer.append(String.format("%02d:%02d:", _hour, _minute));
        BigDecimal second = _second.scale() < 0 ? _second.setScale(0) : _second;
        if (second.compareTo(BigDecimal.TEN) < 0)
        {
            buffer.append('0');
        }
        buffer.append(second.toPlainString());
        return buffer.toString();
    }
}
