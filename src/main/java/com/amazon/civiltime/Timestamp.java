// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import static com.amazon.civiltime.impl._Private_Calendar.MINUTES_PER_DAY;

import com.amazon.civiltime.impl._Private_Calendar;
import com.amazon.civiltime.impl._Private_LeapSeconds;
import com.amazon.civiltime.system.TimestampReaderBuilder;
import com.amazon.civiltime.system.TimestampWriterBuilder;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * An immutable representation of a point in time, with an attached local
 * offset. Time is counted on the UTC scale, including positive leap seconds:
 * the last day of a month in 1972 or later may run to 23:59:60.999...
 * <p>
 * Internally a timestamp is the triple described by {@link Instant}: the
 * number of days since the epoch 2000-01-01, the exact decimal seconds
 * elapsed in that UTC day, and the local offset in minutes. Every
 * other view (calendar fields, epoch seconds, text) is derived from these.
 * Timestamps preserve the precision of the seconds, meaning the number of
 * significant fractional digits; arithmetic is exact and never rounds.
 * <p>
 * Supported timestamps fall between 0000-01-01T00:00:00Z and
 * 9999-12-31T23:59:60.999...Z, and their local time must also fall within
 * years 0 through 9999.
 *
 *
 * <h3>Equality and Comparison</h3>
 *
 * Two relations are defined. <em>Full equivalence</em>, implemented by
 * {@link #equals equals} and {@link #fullyEquals}, requires the same epoch
 * day, the same UTC time of day including its precision, and the same local
 * offset. <em>Temporal equivalence</em>, implemented by
 * {@link #temporallyEquals} and {@link #compareTo}, only asks whether the two
 * timestamps denote the same point in time.
 * Thus the <em>natural comparison method</em> of this class is <em>not
 * consistent with equals</em>. None of the following are {@link #equals} to
 * each other, but any pair will return a zero result from {@link #compareTo}:
 * <ul>
 *   <li>{@code 2009-01-01T00:00:00Z}</li>
 *   <li>{@code 2009-01-01T00:00:00.00Z}</li>
 *   <li>{@code 2009-01-01T00:00:00-00:00}</li>
 *   <li>{@code 2008-12-31T16:00:00-08:00}</li>
 *   <li>{@code 2009-01-01T12:00:00+12:00}</li>
 * </ul>
 *
 * @see #equals(Timestamp)
 * @see #compareTo(Timestamp)
 */
public final class Timestamp
    implements Comparable<Timestamp>
{
    /**
     * Unknown local offset from UTC.
     */
    public static final Integer UNKNOWN_OFFSET = null;

    /**
     * Local offset of zero minutes from UTC.
     */
    public static final Integer UTC_OFFSET = Integer.valueOf(0);

    /**
     * 2000-01-01T00:00:00Z, the origin of {@link #getEpochDays()} and
     * {@link #toEpochSeconds()}.
     */
    public static final Timestamp EPOCH = new Timestamp(0, BigDecimal.ZERO, UTC_OFFSET);

    /**
     * Same as {@link ZoneOffset#ZERO}.
     */
    public static final ZoneOffset ZONE_OFFSET_ZERO = ZoneOffset.ZERO;

    private static final int HASH_SIGNATURE =
        "INTERNAL TIMESTAMP".hashCode();

    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

    private final int        _epochDays;

    /** Seconds since the start of the UTC day, in [0, 86401). */
    private final BigDecimal _utcSeconds;

    /**
     * Minutes offset from UTC; zero means UTC proper,
     * <code>null</code> means that the offset is unknown.
     */
    private final Integer    _offset;


    private Timestamp(int epochDays, BigDecimal utcSeconds, Integer offset)
    {
        _epochDays  = epochDays;
        _utcSeconds = utcSeconds;
        _offset     = offset;
    }


    //=========================================================================
    // Validation

    /**
     * Checks everything an {@link Instant} must satisfy to become a timestamp.
     *
     * @throws CivilTimeException if one of the fields is illegal.
     */
    private static void checkInstantFields(int epochDays, BigDecimal utcSeconds, Integer offset)
    {
        if (utcSeconds == null)
        {
            throw new CivilTimeException(ErrorKind.INVALID_INSTANT,
                                         "UTC time of day must not be null");
        }
        if (offset != null
            && (offset < -ZoneOffset.MAX_TOTAL_MINUTES || offset > ZoneOffset.MAX_TOTAL_MINUTES))
        {
            throw new CivilTimeException(ErrorKind.INVALID_INSTANT,
                String.format("Local offset of %s minutes must be between %s and %s inclusive",
                              offset, -ZoneOffset.MAX_TOTAL_MINUTES, ZoneOffset.MAX_TOTAL_MINUTES));
        }
        checkEpochDays(epochDays);
        _Private_LeapSeconds.checkUtcTimeOfDaySeconds(epochDays, utcSeconds);
        checkLocalDate(epochDays, utcSeconds, offset);
    }

    private static void checkEpochDays(long epochDays)
    {
        if (!_Private_Calendar.isSupportedEpochDay(epochDays))
        {
            throw new CivilTimeException(ErrorKind.OUT_OF_RANGE,
                String.format("Epoch day %s must be between %s (0000-01-01) and %s (9999-12-31) inclusive",
                              epochDays, _Private_Calendar.MIN_EPOCH_DAY, _Private_Calendar.MAX_EPOCH_DAY));
        }
    }

    /**
     * The local date of a timestamp must also be supported, so that it can
     * be printed and read back.
     */
    private static void checkLocalDate(int epochDays, BigDecimal utcSeconds, Integer offset)
    {
        if (offset == null || offset.intValue() == 0) return;

        int localMinutes = utcMinuteOfDay(utcSeconds) + offset.intValue();
        long localDay = (long) epochDays + Math.floorDiv(localMinutes, MINUTES_PER_DAY);
        if (!_Private_Calendar.isSupportedEpochDay(localDay))
        {
            throw new CivilTimeException(ErrorKind.OUT_OF_RANGE,
                "Local offset of " + offset + " minutes moves the local date of epoch day "
                + epochDays + " outside of years 0 through 9999");
        }
    }


    //=========================================================================
    // Creation methods

    /**
     * Returns the timestamp with the given UTC-relative fields. This is the
     * exact inverse of {@link #toInstant()}.
     * <p>
     * Besides the legality of the fields themselves, the local date implied
     * by the offset must fall within years 0 through 9999. For example
     * {@code {epochDays: 2921939, utcTimeOfDaySeconds: 86340,
     * localOffsetMinutes: 1}} is rejected, since its local time would be
     * 10000-01-01T00:00+00:01.
     *
     * @throws InvalidInstantException
     *          with {@link ErrorKind#INVALID_INSTANT} if the UTC time of day
     *          is {@code null} or outside of [0, 86401), or the local offset
     *          is outside of [-1439, 1439];
     *          with {@link ErrorKind#INVALID_LEAP_SECOND} if the time of day
     *          reaches 86400 on a day that cannot hold a leap second;
     *          with {@link ErrorKind#OUT_OF_RANGE} if the UTC or local date
     *          is outside of years 0 through 9999.
     * @throws NullPointerException if {@code instant} is null.
     */
    public static Timestamp fromInstant(Instant instant)
    {
        int epochDays = instant.getEpochDays();
        BigDecimal utcSeconds = instant.getUtcTimeOfDaySeconds();
        Integer offset = instant.getLocalOffsetMinutes();
        try
        {
            checkInstantFields(epochDays, utcSeconds, offset);
        }
        catch (CivilTimeException e)
        {
            throw new InvalidInstantException(e.getKind(),
                                              "Invalid instant " + instant + ": " + e.getMessage(),
                                              e);
        }
        return new Timestamp(epochDays, utcSeconds, offset);
    }

    /**
     * Returns the timestamp for a local date and time in a zone that is
     * {@code offset} ahead of UTC. The UTC instant is found by subtracting
     * the offset, rolling over into the previous or next day where needed,
     * and the offset is kept as the local offset of the result.
     * <p>
     * A second in [60, 61) is only accepted when the local hour and minute
     * correspond to 23:59 UTC on a day that may hold a leap second.
     *
     * @throws CivilTimeException
     *          with {@link ErrorKind#INVALID_LEAP_SECOND} if the time is a
     *          leap second that UTC does not allow at that point;
     *          with {@link ErrorKind#OUT_OF_RANGE} if the UTC date falls
     *          outside of years 0 through 9999.
     * @throws NullPointerException if any argument is null.
     */
    public static Timestamp fromLocalDateTimeOffset(Date date, TimeOfDay time, ZoneOffset offset)
    {
        int offsetMinutes = offset.getTotalMinutes();
        int utcMinutes = time.getHour() * 60 + time.getMinute() - offsetMinutes;
        long epochDays = (long) date.toEpochDays() + Math.floorDiv(utcMinutes, MINUTES_PER_DAY);
        int utcMinuteOfDay = Math.floorMod(utcMinutes, MINUTES_PER_DAY);

        if (time.isLeapSecond() && utcMinuteOfDay != MINUTES_PER_DAY - 1)
        {
            throw new CivilTimeException(ErrorKind.INVALID_LEAP_SECOND,
                "Leap second " + date + "T" + time + offset
                + " does not fall in the last minute of a UTC day");
        }
        checkEpochDays(epochDays);

        BigDecimal utcSeconds = BigDecimal.valueOf(utcMinuteOfDay * 60L).add(time.getSecond());
        _Private_LeapSeconds.checkUtcTimeOfDaySeconds((int) epochDays, utcSeconds);

        return new Timestamp((int) epochDays, utcSeconds, offsetMinutes);
    }

    /**
     * Returns the timestamp that is the given number of seconds from
     * {@link #EPOCH}, with a local offset of zero. Leap seconds are not
     * counted, so this is the exact inverse of {@link #toEpochSeconds()} for
     * every timestamp that is not in a leap second.
     * <p>
     * The precision of the result is that of {@code seconds}.
     *
     * @throws InvalidInstantException with {@link ErrorKind#OUT_OF_RANGE} if
     *          the result would fall outside of years 0 through 9999.
     * @throws NullPointerException if {@code seconds} is null.
     */
    public static Timestamp fromEpochSeconds(BigDecimal seconds)
    {
        BigDecimal days = seconds.divide(_Private_LeapSeconds.SECONDS_PER_DAY, 0, RoundingMode.FLOOR);
        if (days.compareTo(BigDecimal.valueOf(_Private_Calendar.MIN_EPOCH_DAY)) < 0
            || days.compareTo(BigDecimal.valueOf(_Private_Calendar.MAX_EPOCH_DAY)) > 0)
        {
            throw new InvalidInstantException(ErrorKind.OUT_OF_RANGE,
                "Epoch seconds " + seconds.toPlainString()
                + " is outside of the supported range from 0000-01-01T00:00:00Z, inclusive,"
                + " to 10000-01-01T00:00:00Z, exclusive");
        }

        BigDecimal utcSeconds = seconds.subtract(days.multiply(_Private_LeapSeconds.SECONDS_PER_DAY));
        if (utcSeconds.scale() < 0)
        {
            utcSeconds = utcSeconds.setScale(0);
        }
        return new Timestamp(days.intValueExact(), utcSeconds, UTC_OFFSET);
    }

    /**
     * Returns the timestamp denoted by RFC 3339 style text, such as
     * {@code 2016-12-31T23:59:60.5Z} or {@code 2023-06-01T08:30:00.125-07:00}.
     * <p>
     * The year may have any number of digits and an optional sign, but must
     * be between 0 and 9999. The offset {@code -00:00} denotes an unknown local
     * offset. A seconds field of 60 is accepted on days that may hold a leap
     * second.
     *
     * @throws TimestampParseException
     *          with {@link ErrorKind#MALFORMED_TIMESTAMP} if the text does
     *          not match the grammar, or with another kind if its fields
     *          don't describe a supported timestamp.
     * @throws NullPointerException if {@code text} is null.
     *
     * @see TimestampReaderBuilder
     */
    public static Timestamp fromString(CharSequence text)
    {
        return Readers.STANDARD.read(text);
    }

    /**
     * Like {@link #fromString}, but rejects a seconds field of 60 or more
     * with {@link ErrorKind#INVALID_LEAP_SECOND}.
     */
    public static Timestamp fromNoLeapSecondsString(CharSequence text)
    {
        return Readers.NO_LEAP_SECONDS.read(text);
    }

    /**
     * Synonym for {@link #fromString(CharSequence)}.
     */
    public static Timestamp valueOf(CharSequence text)
    {
        return fromString(text);
    }


    //=========================================================================
    // Accessors

    /**
     * Returns the UTC-relative fields of this timestamp.
     */
    public Instant toInstant()
    {
        return new Instant(_epochDays, _utcSeconds, _offset);
    }

    /**
     * Gets the number of UTC days since 2000-01-01; negative for earlier
     * days.
     */
    public int getEpochDays()
    {
        return _epochDays;
    }

    /**
     * Gets the seconds elapsed in the UTC day, at least 0 and less than 86401.
     */
    public BigDecimal getUtcTimeOfDaySeconds()
    {
        return _utcSeconds;
    }

    /**
     * Gets the local offset of this timestamp in minutes ahead of UTC.
     *
     * @return {@code null} ({@link #UNKNOWN_OFFSET}) if the offset is
     *          unknown.
     */
    public Integer getLocalOffsetMinutes()
    {
        return _offset;
    }

    /**
     * Gets the local offset as signed hours and minutes. An unknown offset
     * is reported as {@link ZoneOffset#ZERO}.
     */
    public ZoneOffset getLocalOffset()
    {
        return ZoneOffset.ofTotalMinutes(localOffsetOrZero());
    }

    public Date getUtcDate()
    {
        return _Private_Calendar.dateFromDays(_epochDays);
    }

    /**
     * Gets the UTC time of day. During a leap second this is
     * {@code 23:59:60.x}.
     */
    public TimeOfDay getUtcTimeOfDay()
    {
        int minuteOfDay = utcMinuteOfDay(_utcSeconds);
        return TimeOfDay.of(minuteOfDay / 60, minuteOfDay % 60, secondOfMinute(minuteOfDay));
    }

    /**
     * Gets the date at the local offset of this timestamp; an unknown offset
     * is treated as UTC.
     */
    public Date getLocalDate()
    {
        int localMinutes = utcMinuteOfDay(_utcSeconds) + localOffsetOrZero();
        return _Private_Calendar.dateFromDays(_epochDays
                                              + Math.floorDiv(localMinutes, MINUTES_PER_DAY));
    }

    /**
     * Gets the time of day at the local offset of this timestamp; an unknown
     * offset is treated as UTC. During a leap second the local second is in
     * [60, 61).
     */
    public TimeOfDay getLocalTimeOfDay()
    {
        int utcMinuteOfDay = utcMinuteOfDay(_utcSeconds);
        int localMinuteOfDay = Math.floorMod(utcMinuteOfDay + localOffsetOrZero(), MINUTES_PER_DAY);
        return TimeOfDay.of(localMinuteOfDay / 60,
                            localMinuteOfDay % 60,
                            secondOfMinute(utcMinuteOfDay));
    }

    /**
     * Returns true if this timestamp is within a positive leap second, that
     * is, its UTC time of day is 86400 or more.
     */
    public boolean inLeapSecond()
    {
        return _Private_LeapSeconds.isLeapSecond(_utcSeconds);
    }

    private int localOffsetOrZero()
    {
        return _offset == null ? 0 : _offset.intValue();
    }

    /**
     * A leap second belongs to the last minute of the day.
     */
    private static int utcMinuteOfDay(BigDecimal utcSeconds)
    {
        if (_Private_LeapSeconds.isLeapSecond(utcSeconds))
        {
            return MINUTES_PER_DAY - 1;
        }
        return utcSeconds.divideToIntegralValue(SIXTY).intValue();
    }

    private BigDecimal secondOfMinute(int utcMinuteOfDay)
    {
        return _utcSeconds.subtract(BigDecimal.valueOf(utcMinuteOfDay * 60L));
    }


    //=========================================================================
    // Epoch seconds

    /**
     * Gets the seconds from 2000-01-01T00:00:00Z to this timestamp, ignoring
     * leap seconds: every day counts as 86400 seconds and a partial leap
     * second is clamped away first (see
     * {@link #clampUtcTimeOfDaySeconds(BigDecimal)}). The result is negative
     * for timestamps before the epoch and keeps the precision of the UTC
     * time of day.
     */
    public BigDecimal toEpochSeconds()
    {
        return BigDecimal.valueOf(_epochDays * (long) _Private_Calendar.SECONDS_PER_DAY)
                         .add(clampUtcTimeOfDaySeconds(_utcSeconds));
    }

    /**
     * Returns the exact number of epoch seconds from {@code end} back to
     * {@code start}, that is,
     * {@code end.toEpochSeconds() - start.toEpochSeconds()}.
     */
    public static BigDecimal subtract(Timestamp end, Timestamp start)
    {
        return end.toEpochSeconds().subtract(start.toEpochSeconds());
    }

    /**
     * Returns {@code this.toEpochSeconds() - other.toEpochSeconds()}.
     */
    public BigDecimal subtract(Timestamp other)
    {
        return subtract(this, other);
    }

    /**
     * Removes a partial leap second from a UTC time of day. A value of 86400
     * or more becomes the greatest value less than 86400 that has the same
     * number of fractional digits; smaller values are returned unchanged.
     * For example {@code 86400.50} becomes {@code 86399.99}.
     *
     * @throws NullPointerException if {@code utcTimeOfDaySeconds} is null.
     */
    public static BigDecimal clampUtcTimeOfDaySeconds(BigDecimal utcTimeOfDaySeconds)
    {
        return _Private_LeapSeconds.clamp(utcTimeOfDaySeconds);
    }


    //=========================================================================
    // Modification methods

    /**
     * Returns a timestamp at the same point in time, but with the given local
     * offset. Only the offset changes; the epoch day and UTC time of day are
     * kept exactly. The new offset must still give a local date within years
     * 0 through 9999, as {@link #fromInstant(Instant)} requires.
     *
     * @throws CivilTimeException with {@link ErrorKind#OUT_OF_RANGE} if the
     *          local date would fall outside of years 0 through 9999.
     * @throws NullPointerException if {@code offset} is null.
     */
    public Timestamp withLocalOffset(ZoneOffset offset)
    {
        Integer minutes = offset.getTotalMinutes();
        if (minutes.equals(_offset)) return this;

        checkLocalDate(_epochDays, _utcSeconds, minutes);
        return new Timestamp(_epochDays, _utcSeconds, minutes);
    }

    /**
     * Returns a timestamp at the same point in time whose local offset is
     * unknown.
     */
    public Timestamp withUnknownLocalOffset()
    {
        if (_offset == UNKNOWN_OFFSET) return this;
        return new Timestamp(_epochDays, _utcSeconds, UNKNOWN_OFFSET);
    }

    /**
     * Returns this timestamp with any partial leap second clamped away, so
     * {@code 2016-12-31T23:59:60.25Z} becomes {@code 2016-12-31T23:59:59.99Z}.
     * The local offset is preserved.
     */
    public Timestamp withoutLeapSeconds()
    {
        if (!inLeapSecond()) return this;
        return new Timestamp(_epochDays, clampUtcTimeOfDaySeconds(_utcSeconds), _offset);
    }


    //=========================================================================
    // Text

    /**
     * Returns the text of this Timestamp in its local time, in the form read
     * by {@link #fromString}.
     *
     * @see #toZString()
     * @see #print(Appendable)
     */
    @Override
    public String toString()
    {
        return Writers.LOCAL.format(this);
    }

    /**
     * Returns the text of this Timestamp in UTC, with a {@code Z} offset.
     *
     * @see #toString()
     */
    public String toZString()
    {
        return Writers.UTC.format(this);
    }

    /**
     * Prints the text of this Timestamp in its local time.
     * This method produces the same output as {@link #toString()}.
     *
     * @param out not {@code null}
     *
     * @throws IOException propagated when the {@link Appendable} throws it
     */
    public void print(Appendable out)
        throws IOException
    {
        Writers.LOCAL.write(this, out);
    }

    /**
     * Prints the text of this Timestamp in UTC.
     * This method produces the same output as {@link #toZString()}.
     *
     * @param out not {@code null}
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public void printZ(Appendable out)
        throws IOException
    {
        Writers.UTC.write(this, out);
    }


    //=========================================================================
    // Equality and comparison

    /**
     * Returns a hash code consistent with {@link #equals(Object)}.
     */
    @Override
    public int hashCode()
    {
        final int prime = 8191;
        int result = HASH_SIGNATURE;

        result = prime * result + _utcSeconds.hashCode();
        result ^= (result << 19) ^ (result >> 13);

        result = prime * result + _epochDays;
        result ^= (result << 19) ^ (result >> 13);

        result = prime * result + (_offset == null ? 0 : _offset.hashCode() + 1);
        result ^= (result << 19) ^ (result >> 13);

        return result;
    }

    /**
     * Performs a comparison of the two points in time represented by two
     * Timestamps, ignoring local offset and precision.
     * Note that a {@code 0} result does not imply that the two Timestamps are
     * {@link #equals}.
     *
     * @return
     *          -1, 0, or 1 if this {@code Timestamp}
     *          is less than, equal to, or greater than {@code t} respectively
     *
     * @throws NullPointerException if {@code t} is null.
     */
    public int compareTo(Timestamp t)
    {
        if (_epochDays != t._epochDays)
        {
            return (_epochDays < t._epochDays) ? -1 : 1;
        }
        return _utcSeconds.compareTo(t._utcSeconds);
    }

    /**
     * Determines whether the two timestamps denote the same point in time,
     * regardless of local offset and precision.
     *
     * @throws NullPointerException if {@code t} is null.
     */
    public boolean temporallyEquals(Timestamp t)
    {
        return compareTo(t) == 0;
    }

    /**
     * Same as {@link #equals(Timestamp)}.
     */
    public boolean fullyEquals(Timestamp t)
    {
        return equals(t);
    }

    @Override
    public boolean equals(Object t)
    {
        if (!(t instanceof Timestamp)) return false;
        return equals((Timestamp) t);
    }

    /**
     * Compares this {@link Timestamp} to another {@link Timestamp} object.
     * The result is {@code true} if and only if the parameter has the same
     * epoch day, UTC time of day (including its precision) and local offset
     * as this object.
     * <p>
     * These are {@link #equals} to each other:
     * <ul>
     *   <li>{@code 2001-01-01T11:22:00+00:00}</li>
     *   <li>{@code 2001-01-01T11:22:00Z}</li>
     * </ul>
     * None of these are:
     * <ul>
     *   <li>{@code 2001-01-01T00:00:00-00:00} (unknown local offset)</li>
     *   <li>{@code 2001-01-01T00:00:00+00:00} (in UTC)</li>
     *   <li>{@code 2001-01-01T00:00:00.000+00:00} (millisecond precision)</li>
     *   <li>{@code 2001-01-01T01:00:00+01:00} (a different local offset)</li>
     * </ul>
     *
     * @see #compareTo(Timestamp)
     */
    public boolean equals(Timestamp t)
    {
        if (this == t) return true;
        if (t == null) return false;

        return _epochDays == t._epochDays
            && _utcSeconds.equals(t._utcSeconds)
            && Objects.equals(_offset, t._offset);
    }


    //=========================================================================

    private static final class Readers
    {
        static final TimestampReader STANDARD =
            TimestampReaderBuilder.standard().build();

        static final TimestampReader NO_LEAP_SECONDS =
            TimestampReaderBuilder.standard().withLeapSecondsAllowed(false).build();
    }

    private static final class Writers
    {
        static final TimestampWriter LOCAL =
            TimestampWriterBuilder.standard().build();

        static final TimestampWriter UTC =
            TimestampWriterBuilder.standard().withUtcOutput(true).build();
    }
}
