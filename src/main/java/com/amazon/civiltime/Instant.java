// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The UTC-relative decomposition of a {@link Timestamp}: a day count from
 * 2000-01-01, the seconds elapsed in that UTC day, and the local offset.
 * <p>
 * An {@code Instant} is a plain record and performs no validation. An
 * instance obtained from {@link Timestamp#toInstant()} is always legal;
 * {@link Timestamp#fromInstant(Instant)} rejects the others. A legal instance
 * satisfies these conditions:
 * <ul>
 *   <li>the epoch day lies between 0000-01-01 and 9999-12-31;</li>
 *   <li>the UTC time of day is at least 0 and less than 86401, and reaches
 *     86400 only on the last day of a month in 1972 or later;</li>
 *   <li>the local offset is {@code null} or between -1439 and 1439 minutes,
 *     and the local date it implies lies in years 0 through 9999.</li>
 * </ul>
 *
 * <h3>Equality</h3>
 * {@link #equals} compares all three fields exactly, including the scale of
 * the UTC time of day. {@link #temporallyEquals} compares only the point in
 * time.
 */
public final class Instant
{
    private final int        _epochDays;
    private final BigDecimal _utcTimeOfDaySeconds;
    private final Integer    _localOffsetMinutes;

    /**
     * @param epochDays days since 2000-01-01.
     * @param utcTimeOfDaySeconds seconds since the start of that UTC day.
     * @param localOffsetMinutes minutes the local time is ahead of UTC;
     *  {@code null} means UTC with an unknown local offset, which is not the
     *  same as zero.
     */
    public Instant(int epochDays, BigDecimal utcTimeOfDaySeconds, Integer localOffsetMinutes)
    {
        _epochDays = epochDays;
        _utcTimeOfDaySeconds = utcTimeOfDaySeconds;
        _localOffsetMinutes = localOffsetMinutes;
    }

    public int getEpochDays()
    {
        return _epochDays;
    }

    public BigDecimal getUtcTimeOfDaySeconds()
    {
        return _utcTimeOfDaySeconds;
    }

    /**
     * @return {@code null} if the local offset is unknown.
     */
    public Integer getLocalOffsetMinutes()
    {
        return _localOffsetMinutes;
    }

    /**
     * Compares the epoch day and the numeric value of the UTC time of day,
     * ignoring the local offset and the precision of the seconds.
     *
     * @throws NullPointerException if either UTC time of day is null.
     */
    public boolean temporallyEquals(Instant other)
    {
        return _epochDays == other._epochDays
            && _utcTimeOfDaySeconds.compareTo(other._utcTimeOfDaySeconds) == 0;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof Instant)) return false;
        Instant that = (Instant) other;
        return _epochDays == that._epochDays
            && Objects.equals(_utcTimeOfDaySeconds, that._utcTimeOfDaySeconds)
            && Objects.equals(_localOffsetMinutes, that._localOffsetMinutes);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_epochDays, _utcTimeOfDaySeconds, _localOffsetMinutes);
    }

    @Override
    public String toString()
    {
        return "{epochDays:" + _epochDays
            + ",utcTimeOfDaySeconds:"
            + (_utcTimeOfDaySeconds == null ? "null" : _utcTimeOfDaySeconds.toPlainString())
            + ",localOffsetMinutes:" + _localOffsetMinutes
            + "}";
    }
}
