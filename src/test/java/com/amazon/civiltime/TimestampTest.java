// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import static com.amazon.civiltime.Timestamp.UNKNOWN_OFFSET;
import static com.amazon.civiltime.Timestamp.UTC_OFFSET;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.math.BigDecimal;

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TimestampTest
{
    @Rule
    public ExpectedException thrown = ExpectedException.none();

    private static final int DAY_2016_12_31 = 6209;
    private static final int DAY_2023_06_29 = 8580;
    private static final int DAY_2023_06_30 = 8581;
    private static final int DAY_2023_12_31 = 8765;
    private static final int DAY_9999_12_31 = 2921939;

    private static BigDecimal dec(String text)
    {
        return new BigDecimal(text);
    }

    private static Instant instant(int epochDays, String seconds, Integer offset)
    {
        return new Instant(epochDays, dec(seconds), offset);
    }

    private static void checkInstant(Instant expected, String text)
    {
        Timestamp ts = Timestamp.valueOf(text);
        assertEquals(text, expected, ts.toInstant());
        assertEquals(text, ts.toString());
    }

    static Matcher<Throwable> hasKind(final ErrorKind kind)
    {
        return new TypeSafeMatcher<Throwable>()
        {
            @Override
            protected boolean matchesSafely(Throwable e)
            {
                if (e instanceof CivilTimeException)
                {
                    return ((CivilTimeException) e).getKind() == kind;
                }
                if (e instanceof InvalidInstantException)
                {
                    return ((InvalidInstantException) e).getKind() == kind;
                }
                return false;
            }

            @Override
            public void describeTo(Description description)
            {
                description.appendText("exception of kind ").appendValue(kind);
            }
        };
    }

    private void expectInvalidInstant(ErrorKind kind)
    {
        thrown.expect(InvalidInstantException.class);
        thrown.expect(hasKind(kind));
    }


    //=========================================================================
    // Creation

    @Test
    public void testEpoch()
    {
        assertEquals(instant(0, "0", 0), Timestamp.EPOCH.toInstant());
        assertEquals("2000-01-01T00:00:00Z", Timestamp.EPOCH.toString());
        assertEquals(Timestamp.EPOCH, Timestamp.valueOf("2000-01-01T00:00:00Z"));
        assertEquals(Date.of(2000, 1, 1), Timestamp.EPOCH.getUtcDate());
        assertEquals(TimeOfDay.MIDNIGHT, Timestamp.EPOCH.getUtcTimeOfDay());
        assertSame(ZoneOffset.ZERO, Timestamp.EPOCH.getLocalOffset());
    }

    @Test
    public void testParseToInstant()
    {
        checkInstant(instant(-1, "86399.999", 0), "1999-12-31T23:59:59.999Z");
        checkInstant(instant(DAY_2023_12_31, "86400.5", 0), "2023-12-31T23:59:60.5Z");
        checkInstant(instant(DAY_2016_12_31, "86400", UNKNOWN_OFFSET), "2016-12-31T23:59:60-00:00");

        // The local offset is subtracted, rolling over into the previous day
        checkInstant(instant(-1, "84600", 60), "2000-01-01T00:30:00+01:00");
        // or the next.
        checkInstant(instant(0, "1800", -60), "1999-12-31T23:30:00-01:00");
        checkInstant(instant(0, "0", 1439), "2000-01-01T23:59:00+23:59");
    }

    @Test
    public void testLocalLeapSecondMapsToLastUtcMinute()
    {
        Timestamp ts = Timestamp.valueOf("2024-01-01T00:59:60+01:00");
        assertEquals(instant(DAY_2023_12_31, "86400", 60), ts.toInstant());
        assertEquals("2023-12-31T23:59:60Z", ts.toZString());
        assertEquals(Date.of(2024, 1, 1), ts.getLocalDate());
        assertEquals(TimeOfDay.of(0, 59, 60), ts.getLocalTimeOfDay());
        assertEquals(TimeOfDay.of(23, 59, 60), ts.getUtcTimeOfDay());
        assertTrue(ts.inLeapSecond());

        ts = Timestamp.valueOf("2023-06-30T19:29:60.75-04:30");
        assertEquals(instant(DAY_2023_06_30, "86400.75", -270), ts.toInstant());
    }

    @Test
    public void testLeapSecondNotInLastUtcMinute()
    {
        TimestampParseException e = assertThrows(TimestampParseException.class,
            () -> Timestamp.valueOf("2023-12-31T23:59:60+01:00"));
        assertEquals(ErrorKind.INVALID_LEAP_SECOND, e.getKind());
    }

    @Test
    public void testLeapSecondOnLastDayOfMonth()
    {
        assertEquals(instant(DAY_2023_06_30, "86400", 0),
                     Timestamp.valueOf("2023-06-30T23:59:60Z").toInstant());
    }

    @Test
    public void testLeapSecondOnOtherDay()
    {
        thrown.expect(TimestampParseException.class);
        thrown.expect(hasKind(ErrorKind.INVALID_LEAP_SECOND));
        Timestamp.valueOf("2023-06-29T23:59:60Z");
    }

    @Test
    public void testFromLocalDateTimeOffset()
    {
        Timestamp ts = Timestamp.fromLocalDateTimeOffset(Date.of(2023, 6, 1),
                                                         TimeOfDay.of(8, 30, dec("0.125")),
                                                         ZoneOffset.of(-1, 7, 0));
        assertEquals("2023-06-01T08:30:00.125-07:00", ts.toString());
        assertEquals("2023-06-01T15:30:00.125Z", ts.toZString());
        assertEquals(Integer.valueOf(-420), ts.getLocalOffsetMinutes());
        assertEquals(ZoneOffset.of(-1, 7, 0), ts.getLocalOffset());
        assertEquals(Date.of(2023, 6, 1), ts.getLocalDate());
        assertEquals(TimeOfDay.of(8, 30, dec("0.125")), ts.getLocalTimeOfDay());
    }

    @Test
    public void testFromLocalDateTimeOffsetLeapSecond()
    {
        Timestamp ts = Timestamp.fromLocalDateTimeOffset(Date.of(2023, 12, 31),
                                                         TimeOfDay.of(23, 59, dec("60.5")),
                                                         ZoneOffset.ZERO);
        assertTrue(ts.inLeapSecond());
        assertEquals(instant(DAY_2023_12_31, "86400.5", 0), ts.toInstant());
    }

    @Test
    public void testFromLocalDateTimeOffsetLeapSecondOnOtherDay()
    {
        CivilTimeException e = assertThrows(CivilTimeException.class,
            () -> Timestamp.fromLocalDateTimeOffset(Date.of(2023, 6, 29),
                                                    TimeOfDay.of(23, 59, dec("60.5")),
                                                    ZoneOffset.ZERO));
        assertEquals(ErrorKind.INVALID_LEAP_SECOND, e.getKind());
        // Not text, so not a parse failure.
        assertFalse(e instanceof TimestampParseException);
    }

    @Test
    public void testFromLocalDateTimeOffsetBeforeYearZero()
    {
        thrown.expect(CivilTimeException.class);
        thrown.expect(hasKind(ErrorKind.OUT_OF_RANGE));
        Timestamp.fromLocalDateTimeOffset(Date.of(0, 1, 1),
                                          TimeOfDay.of(0, 30, 0),
                                          ZoneOffset.of(1, 1, 0));
    }


    //=========================================================================
    // fromInstant

    @Test
    public void testInstantRoundTrip()
    {
        Instant[] instants = {
            instant(0, "0", 0),
            instant(-730485, "0", null),
            instant(DAY_9999_12_31, "86399.999999999", 0),
            instant(DAY_2016_12_31, "86400.999", -1439),
            instant(DAY_2023_06_30, "43200.00", 330),
            instant(-1, "0.5", -60),
        };
        for (Instant i : instants)
        {
            assertEquals(i, Timestamp.fromInstant(i).toInstant());
        }
    }

    @Test
    public void testFromInstantLeapSecondOnOtherDay()
    {
        expectInvalidInstant(ErrorKind.INVALID_LEAP_SECOND);
        Timestamp.fromInstant(instant(DAY_2023_06_29, "86400", 0));
    }

    @Test
    public void testFromInstantTimeOfDayTooLarge()
    {
        expectInvalidInstant(ErrorKind.INVALID_INSTANT);
        Timestamp.fromInstant(instant(DAY_2023_06_30, "86401", 0));
    }

    @Test
    public void testFromInstantNegativeTimeOfDay()
    {
        expectInvalidInstant(ErrorKind.INVALID_INSTANT);
        Timestamp.fromInstant(instant(0, "-0.001", null));
    }

    @Test
    public void testFromInstantNullTimeOfDay()
    {
        expectInvalidInstant(ErrorKind.INVALID_INSTANT);
        Timestamp.fromInstant(new Instant(0, null, 0));
    }

    @Test
    public void testFromInstantOffsetTooLarge()
    {
        expectInvalidInstant(ErrorKind.INVALID_INSTANT);
        Timestamp.fromInstant(instant(0, "0", 1440));
    }

    @Test
    public void testFromInstantDayOutOfRange()
    {
        expectInvalidInstant(ErrorKind.OUT_OF_RANGE);
        Timestamp.fromInstant(instant(DAY_9999_12_31 + 1, "0", 0));
    }

    @Test
    public void testFromInstantLocalDateOutOfRange()
    {
        expectInvalidInstant(ErrorKind.OUT_OF_RANGE);
        Timestamp.fromInstant(instant(DAY_9999_12_31, "86340", 1));
    }

    @Test
    public void testInvalidInstantIsIllegalArgument()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Timestamp.fromInstant(instant(0, "86400", 0)));
        assertTrue(e instanceof InvalidInstantException);
        assertTrue(e.getCause() instanceof CivilTimeException);
    }


    //=========================================================================
    // Epoch seconds

    @Test
    public void testFromEpochSeconds()
    {
        Timestamp ts = Timestamp.fromEpochSeconds(BigDecimal.ZERO);
        assertEquals(Timestamp.EPOCH, ts);
        assertTrue(ts.temporallyEquals(Timestamp.EPOCH));

        assertEquals(instant(-1, "86399.5", 0),
                     Timestamp.fromEpochSeconds(dec("-0.5")).toInstant());
        assertEquals("1999-12-31T23:59:59.5Z",
                     Timestamp.fromEpochSeconds(dec("-0.5")).toString());
        assertEquals("9999-12-31T23:59:59.999Z",
                     Timestamp.fromEpochSeconds(dec("252455615999.999")).toString());
        assertEquals("0000-01-01T00:00:00Z",
                     Timestamp.fromEpochSeconds(dec("-63113904000")).toString());
        assertEquals(UTC_OFFSET, Timestamp.fromEpochSeconds(dec("1e3")).getLocalOffsetMinutes());
        assertEquals("2000-01-01T00:16:40Z", Timestamp.fromEpochSeconds(dec("1e3")).toString());
    }

    @Test
    public void testFromEpochSecondsAfterYear9999()
    {
        expectInvalidInstant(ErrorKind.OUT_OF_RANGE);
        Timestamp.fromEpochSeconds(dec("252455616000"));
    }

    @Test
    public void testFromEpochSecondsBeforeYearZero()
    {
        expectInvalidInstant(ErrorKind.OUT_OF_RANGE);
        Timestamp.fromEpochSeconds(dec("-63113904000.001"));
    }

    @Test
    public void testToEpochSeconds()
    {
        assertEquals(dec("0"), Timestamp.EPOCH.toEpochSeconds());
        assertEquals(dec("-3600"), Timestamp.valueOf("2000-01-01T00:00:00+01:00").toEpochSeconds());
        assertEquals(dec("536543999.99"),
                     Timestamp.valueOf("2016-12-31T23:59:60.25Z").toEpochSeconds());
        assertEquals(dec("536543999"),
                     Timestamp.valueOf("2016-12-31T23:59:60Z").toEpochSeconds());
    }

    @Test
    public void testEpochSecondsRoundTrip()
    {
        String[] texts = {
            "2000-01-01T00:00:00Z",
            "1970-01-01T00:00:00.000Z",
            "2023-06-01T08:30:00.125Z",
            "0000-03-01T12:00:00Z",
            "9999-12-31T23:59:59.999999Z",
        };
        for (String text : texts)
        {
            Timestamp ts = Timestamp.valueOf(text);
            assertEquals(text, ts, Timestamp.fromEpochSeconds(ts.toEpochSeconds()));
        }
    }

    @Test
    public void testSubtract()
    {
        Timestamp newYear = Timestamp.valueOf("2017-01-01T00:00:00Z");
        Timestamp lastSecond = Timestamp.valueOf("2016-12-31T23:59:59Z");
        Timestamp leapSecond = Timestamp.valueOf("2016-12-31T23:59:60.5Z");

        // Leap seconds are not counted.
        assertEquals(dec("1"), Timestamp.subtract(newYear, lastSecond));
        assertEquals(dec("-1"), lastSecond.subtract(newYear));
        assertEquals(dec("0.9"), leapSecond.subtract(lastSecond));
        assertEquals(dec("0.1"), newYear.subtract(leapSecond));

        assertEquals(dec("0"), Timestamp.valueOf("2000-01-01T01:00:00+01:00")
                                        .subtract(Timestamp.EPOCH));
    }

    @Test
    public void testClampUtcTimeOfDaySeconds()
    {
        assertEquals(dec("86399.99"), Timestamp.clampUtcTimeOfDaySeconds(dec("86400.50")));
        assertEquals(dec("86399"), Timestamp.clampUtcTimeOfDaySeconds(dec("86400")));
        assertEquals(dec("12.5"), Timestamp.clampUtcTimeOfDaySeconds(dec("12.5")));
    }


    //=========================================================================
    // Modification

    @Test
    public void testWithLocalOffset()
    {
        Timestamp utc = Timestamp.valueOf("2023-12-31T23:59:60.5Z");
        Timestamp local = utc.withLocalOffset(ZoneOffset.of(1, 5, 30));

        assertEquals(utc.getEpochDays(), local.getEpochDays());
        assertEquals(utc.getUtcTimeOfDaySeconds(), local.getUtcTimeOfDaySeconds());
        assertEquals(Integer.valueOf(330), local.getLocalOffsetMinutes());
        assertEquals("2024-01-01T05:29:60.5+05:30", local.toString());
        assertTrue(local.temporallyEquals(utc));
        assertFalse(local.equals(utc));

        assertSame(local, local.withLocalOffset(ZoneOffset.of(1, 5, 30)));
    }

    @Test
    public void testWithLocalOffsetOutOfRange()
    {
        thrown.expect(CivilTimeException.class);
        thrown.expect(hasKind(ErrorKind.OUT_OF_RANGE));
        Timestamp.valueOf("9999-12-31T23:00:00Z").withLocalOffset(ZoneOffset.of(1, 1, 0));
    }

    @Test
    public void testWithUnknownLocalOffset()
    {
        Timestamp ts = Timestamp.valueOf("2020-02-29T12:00:00+02:00").withUnknownLocalOffset();
        assertNull(ts.getLocalOffsetMinutes());
        assertEquals("2020-02-29T10:00:00-00:00", ts.toString());
        assertSame(ts, ts.withUnknownLocalOffset());
        // An unknown offset is viewed as UTC.
        assertEquals(ZoneOffset.ZERO, ts.getLocalOffset());
        assertEquals(ts.getUtcDate(), ts.getLocalDate());
    }

    @Test
    public void testWithoutLeapSeconds()
    {
        Timestamp leap = Timestamp.valueOf("2017-01-01T00:59:60.25+01:00");
        Timestamp clamped = leap.withoutLeapSeconds();
        assertFalse(clamped.inLeapSecond());
        assertEquals(dec("86399.99"), clamped.getUtcTimeOfDaySeconds());
        assertEquals(leap.getLocalOffsetMinutes(), clamped.getLocalOffsetMinutes());
        assertEquals("2017-01-01T00:59:59.99+01:00", clamped.toString());

        Timestamp plain = Timestamp.valueOf("2016-12-31T23:59:59Z");
        assertSame(plain, plain.withoutLeapSeconds());
    }


    //=========================================================================
    // Text

    @Test
    public void testPrecisionIsKept()
    {
        assertEquals("2001-01-01T00:00:00.000Z",
                     Timestamp.valueOf("2001-01-01T00:00:00.000Z").toString());
        assertEquals("2001-01-01T00:00:00.100Z",
                     Timestamp.valueOf("2001-01-01T00:00:00.100Z").toString());
        assertEquals("2001-01-01T00:00:05.5Z",
                     Timestamp.valueOf("2001-01-01T00:00:05.5Z").toString());
    }

    @Test
    public void testZeroOffsetPrintsZ()
    {
        assertEquals("2001-01-01T11:22:00Z", Timestamp.valueOf("2001-01-01T11:22:00+00:00").toString());
        assertEquals("2001-01-01T11:22:00Z", Timestamp.valueOf("2001-01-01t11:22:00z").toString());
    }

    @Test
    public void testPrint() throws IOException
    {
        Timestamp ts = Timestamp.valueOf("1999-12-31T23:30:00-01:00");
        StringBuilder out = new StringBuilder();
        ts.print(out);
        out.append(' ');
        ts.printZ(out);
        assertEquals("1999-12-31T23:30:00-01:00 2000-01-01T00:30:00Z", out.toString());
    }

    @Test
    public void testNoLeapSecondsString()
    {
        assertEquals(Timestamp.valueOf("2016-12-31T23:59:59Z"),
                     Timestamp.fromNoLeapSecondsString("2016-12-31T23:59:59Z"));

        thrown.expect(TimestampParseException.class);
        thrown.expect(hasKind(ErrorKind.INVALID_LEAP_SECOND));
        Timestamp.fromNoLeapSecondsString("2016-12-31T23:59:60Z");
    }


    //=========================================================================
    // Equality and comparison

    @Test
    public void testEquals()
    {
        Timestamp z = Timestamp.valueOf("2001-01-01T11:22:00Z");
        Timestamp plusZero = Timestamp.valueOf("2001-01-01T11:22:00+00:00");
        assertEquals(z, plusZero);
        assertEquals(z.hashCode(), plusZero.hashCode());
        assertTrue(z.fullyEquals(plusZero));

        Timestamp unknown = Timestamp.valueOf("2001-01-01T11:22:00-00:00");
        Timestamp millis = Timestamp.valueOf("2001-01-01T11:22:00.000Z");
        Timestamp shifted = Timestamp.valueOf("2001-01-01T12:22:00+01:00");
        for (Timestamp other : new Timestamp[] { unknown, millis, shifted })
        {
            assertNotEquals(z, other);
            assertFalse(z.fullyEquals(other));
            assertTrue(z.temporallyEquals(other));
            assertEquals(0, z.compareTo(other));
        }

        assertFalse(z.equals((Object) "2001-01-01T11:22:00Z"));
        assertFalse(z.equals((Timestamp) null));
    }

    @Test
    public void testCompareTo()
    {
        Timestamp before = Timestamp.valueOf("2016-12-31T23:59:59.999Z");
        Timestamp leap = Timestamp.valueOf("2016-12-31T23:59:60Z");
        Timestamp after = Timestamp.valueOf("2017-01-01T00:00:00Z");

        assertEquals(-1, before.compareTo(leap));
        assertEquals(-1, leap.compareTo(after));
        assertEquals(1, after.compareTo(before));
        assertTrue(Timestamp.valueOf("1999-12-31T23:59:59Z").compareTo(Timestamp.EPOCH) < 0);
    }

    @Test
    public void testTemporalEqualityIsReflexiveSymmetricTransitive()
    {
        Timestamp a = Timestamp.valueOf("2023-06-30T23:59:60.5Z");
        Timestamp b = Timestamp.valueOf("2023-07-01T05:29:60.50+05:30");
        Timestamp c = Timestamp.valueOf("2023-06-30T23:59:60.500-00:00");

        assertTrue(a.temporallyEquals(a));
        assertTrue(a.temporallyEquals(b) && b.temporallyEquals(a));
        assertTrue(b.temporallyEquals(c) && a.temporallyEquals(c));
        assertTrue(a.toInstant().temporallyEquals(c.toInstant()));
        assertFalse(a.toInstant().equals(c.toInstant()));
    }
}
