// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

/**
 * An immutable, fixed displacement of local time from UTC, such as
 * {@code +05:30} or {@code -08:00}. A positive sign means local time is ahead
 * of UTC.
 * <p>
 * There is no negative zero: the zero offset always has a positive sign. The
 * text {@code -00:00}, which denotes an unknown local offset, has no
 * {@code ZoneOffset} counterpart.
 */
public final class ZoneOffset
{
    /** The largest magnitude of an offset, 23:59, in minutes. */
    public static final int MAX_TOTAL_MINUTES = 23 * 60 + 59;

    /** {@code +00:00} */
    public static final ZoneOffset ZERO = new ZoneOffset(1, 0, 0);

    private final byte _sign;
    private final byte _hour;
    private final byte _minute;

    private ZoneOffset(int sign, int hour, int minute)
    {
        _sign   = (byte) sign;
        _hour   = (byte) hour;
        _minute = (byte) minute;
    }

    /**
     * @param sign +1 or -1; must be +1 when hour and minute are both 0.
     * @param hour 0 through 23.
     * @param minute 0 through 59.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_ZONE_OFFSET}
     * if a field is out of range.
     */
    public static ZoneOffset of(int sign, int hour, int minute)
    {
        if (sign != 1 && sign != -1)
        {
            throw new CivilTimeException(ErrorKind.INVALID_ZONE_OFFSET,
                String.format("Offset sign %s must be 1 or -1", sign));
        }
        if (hour < 0 || hour > 23)
        {
            throw new CivilTimeException(ErrorKind.INVALID_ZONE_OFFSET,
                String.format("Offset hours %s must be between 0 and 23 inclusive", hour));
        }
        if (minute < 0 || minute > 59)
        {
            throw new CivilTimeException(ErrorKind.INVALID_ZONE_OFFSET,
                String.format("Offset minutes %s must be between 0 and 59 inclusive", minute));
        }
        if (hour == 0 && minute == 0)
        {
            if (sign < 0)
            {
                throw new CivilTimeException(ErrorKind.INVALID_ZONE_OFFSET,
                    "The zero offset must have a positive sign");
            }
            return ZERO;
        }
        return new ZoneOffset(sign, hour, minute);
    }

    /**
     * Decomposes a number of minutes from UTC into sign, hours and minutes.
     *
     * @param totalMinutes between -1439 and 1439 inclusive.
     *
     * @throws CivilTimeException with {@link ErrorKind#INVALID_ZONE_OFFSET}
     * if the value is out of range.
     */
    public static ZoneOffset ofTotalMinutes(int totalMinutes)
    {
        if (totalMinutes < -MAX_TOTAL_MINUTES || totalMinutes > MAX_TOTAL_MINUTES)
        {
            throw new CivilTimeException(ErrorKind.INVALID_ZONE_OFFSET,
                String.format("Offset of %s minutes must be between %s and %s inclusive",
                              totalMinutes, -MAX_TOTAL_MINUTES, MAX_TOTAL_MINUTES));
        }
        if (totalMinutes == 0) return ZERO;

        int sign = totalMinutes < 0 ? -1 : 1;
        int magnitude = Math.abs(totalMinutes);
        return new ZoneOffset(sign, magnitude / 60, magnitude % 60);
    }


    /** @return +1 or -1. */
    public int getSign()
    {
        return _sign;
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
     * Gets the signed offset in minutes; for example -480 for {@code -08:00}.
     */
    public int getTotalMinutes()
    {
        return _sign * (_hour * 60 + _minute);
    }


    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof ZoneOffset)) return false;
        return getTotalMinutes() == ((ZoneOffset) other).getTotalMinutes();
    }

    @Override
    public int hashCode()
    {
        return getTotalMinutes();
    }

    /**
     * Returns the offset in {@code +hh:mm} or {@code -hh:mm} form.
     */
    @Override
    public String toString()
    {
        return String.format("%c%02d:%02d", _sign < 0 ? '-' : '+', _hour, _minute);
    }
}
