// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.impl;

import static com.amazon.civiltime.util.CivilTimeTextUtils.printCodePointAsString;

import com.amazon.civiltime.CivilTimeException;
import com.amazon.civiltime.Date;
import com.amazon.civiltime.ErrorKind;
import com.amazon.civiltime.TimeOfDay;
import com.amazon.civiltime.Timestamp;
import com.amazon.civiltime.TimestampParseException;
import com.amazon.civiltime.TimestampReader;
import com.amazon.civiltime.TimestampWriter;
import com.amazon.civiltime.ZoneOffset;
import com.amazon.civiltime.util.CivilTimeTextUtils;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * The text form of timestamps:
 * <pre>
 * timestamp = year "-" MM "-" DD ("T"|"t") hh ":" mm ":" ss [ "." 1*DIGIT ] offset
 * year      = [ "+" | "-" ] 1*DIGIT
 * offset    = "Z" | "z" | ( "+" | "-" ) hh ":" mm
 * </pre>
 * The text is first matched against the grammar as a whole, and only then are
 * the field values checked, so that a syntax error is always reported as
 * {@link ErrorKind#MALFORMED_TIMESTAMP}.
 *
 * <b>This class is not intended for general use.</b>
 */
public final class _Private_TimestampText
{
    private _Private_TimestampText() { }

    /** Year values above this are not accumulated any further. */
    private static final int YEAR_OVERFLOW = _Private_Calendar.MAX_YEAR + 1;


    public static TimestampReader newReader(boolean leapSecondsAllowed,
                                            boolean lowercaseDesignatorsAllowed)
    {
        return new TextReader(leapSecondsAllowed, lowercaseDesignatorsAllowed);
    }

    public static TimestampWriter newWriter(boolean utcOutput, boolean zuluForZeroOffset)
    {
        return new TextWriter(utcOutput, zuluForZeroOffset);
    }


    //=========================================================================
    // Reading

    private static TimestampParseException fail(CharSequence input, int position, String reason)
    {
        return new TimestampParseException(ErrorKind.MALFORMED_TIMESTAMP,
                                           "invalid timestamp: " + reason + ": "
                                               + CivilTimeTextUtils.printString(input),
                                           position);
    }

    private static TimestampParseException fail(CharSequence input, int position,
                                                CivilTimeException cause)
    {
        return new TimestampParseException(cause.getKind(),
                                           "invalid timestamp: " + cause.getMessage() + ": "
                                               + CivilTimeTextUtils.printString(input),
                                           position,
                                           cause);
    }

    private static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    private static String describe(CharSequence in, int pos)
    {
        return pos < in.length() ? printCodePointAsString(in.charAt(pos)) : "end of text";
    }

    /**
     * Reads exactly {@code length} ASCII digits.
     */
    private static int readDigits(CharSequence in, int start, int length, String field)
    {
        int value = 0;
        for (int ii = start; ii < start + length; ii++)
        {
            if (ii >= in.length())
            {
                throw fail(in, ii, field + " requires " + length + " digits");
            }
            char c = in.charAt(ii);
            if (!isDigit(c))
            {
                throw fail(in, ii, field + " has non-digit character " + describe(in, ii));
            }
            value = value * 10 + (c - '0');
        }
        return value;
    }

    private static int expect(CharSequence in, int pos, char expected, String after)
    {
        if (pos >= in.length() || in.charAt(pos) != expected)
        {
            throw fail(in, pos,
                       "expected " + printCodePointAsString(expected) + " after " + after
                           + ", found " + describe(in, pos));
        }
        return pos + 1;
    }

    private static boolean isDesignator(char c, char designator, boolean lowercaseAllowed)
    {
        return c == designator
            || (lowercaseAllowed && c == Character.toLowerCase(designator));
    }


    private static final class TextReader
        implements TimestampReader
    {
        private final boolean myLeapSecondsAllowed;
        private final boolean myLowercaseAllowed;

        TextReader(boolean leapSecondsAllowed, boolean lowercaseAllowed)
        {
            myLeapSecondsAllowed = leapSecondsAllowed;
            myLowercaseAllowed = lowercaseAllowed;
        }

        public Timestamp read(CharSequence in)
        {
            final int length = in.length();
            if (length == 0)
            {
                throw fail(in, 0, "empty text");
            }

            // Year: optional sign, then one or more digits.
            int pos = 0;
            boolean negativeYear = false;
            char c = in.charAt(0);
            if (c == '+' || c == '-')
            {
                negativeYear = (c == '-');
                pos++;
            }
            final int yearStart = pos;
            int year = 0;
            while (pos < length && isDigit(in.charAt(pos)))
            {
                if (year < YEAR_OVERFLOW)
                {
                    year = year * 10 + (in.charAt(pos) - '0');
                }
                pos++;
            }
            if (pos == yearStart)
            {
                throw fail(in, pos, "year requires at least one digit, found " + describe(in, pos));
            }
            pos = expect(in, pos, '-', "year");

            final int monthStart = pos;
            int month = readDigits(in, pos, 2, "month");
            pos = expect(in, pos + 2, '-', "month");
            int day = readDigits(in, pos, 2, "day");
            pos += 2;
            if (pos >= length || !isDesignator(in.charAt(pos), 'T', myLowercaseAllowed))
            {
                throw fail(in, pos, "expected \"T\" after day, found " + describe(in, pos));
            }
            pos++;

            final int timeStart = pos;
            int hour = readDigits(in, pos, 2, "hour");
            pos = expect(in, pos + 2, ':', "hour");
            int minute = readDigits(in, pos, 2, "minute");
            pos = expect(in, pos + 2, ':', "minute");

            final int secondStart = pos;
            readDigits(in, pos, 2, "seconds");
            pos += 2;
            if (pos < length && in.charAt(pos) == '.')
            {
                pos++;
                int fractionStart = pos;
                while (pos < length && isDigit(in.charAt(pos)))
                {
                    pos++;
                }
                if (pos == fractionStart)
                {
                    throw fail(in, pos, "must have at least one digit after decimal point");
                }
            }
            BigDecimal second = new BigDecimal(in.subSequence(secondStart, pos).toString());

            // Local offset
            final int offsetStart = pos;
            if (pos >= length)
            {
                throw fail(in, pos, "missing local offset");
            }
            c = in.charAt(pos);
            int offsetSign = 1;
            int offsetHours = 0;
            int offsetMinutes = 0;
            if (isDesignator(c, 'Z', myLowercaseAllowed))
            {
                pos++;
            }
            else if (c == '+' || c == '-')
            {
                offsetSign = (c == '-') ? -1 : 1;
                pos++;
                offsetHours = readDigits(in, pos, 2, "local offset hours");
                pos = expect(in, pos + 2, ':', "local offset hours");
                offsetMinutes = readDigits(in, pos, 2, "local offset minutes");
                pos += 2;
            }
            else
            {
                throw fail(in, pos,
                           "expected \"Z\" or a numeric local offset, found " + describe(in, pos));
            }
            if (pos != length)
            {
                throw fail(in, pos, "invalid excess characters");
            }

            // The text is well-formed; now check the field values.
            if (year >= YEAR_OVERFLOW || (negativeYear && year != 0))
            {
                throw new TimestampParseException(ErrorKind.OUT_OF_RANGE,
                    "invalid timestamp: year must be between 0 and 9999 inclusive: "
                        + CivilTimeTextUtils.printString(in),
                    0);
            }

            Date date;
            try
            {
                date = Date.of(year, month, day);
            }
            catch (CivilTimeException e)
            {
                throw fail(in, monthStart, e);
            }

            TimeOfDay time;
            try
            {
                time = TimeOfDay.of(hour, minute, second);
            }
            catch (CivilTimeException e)
            {
                throw fail(in, timeStart, e);
            }
            if (!myLeapSecondsAllowed && time.isLeapSecond())
            {
                throw new TimestampParseException(ErrorKind.INVALID_LEAP_SECOND,
                    "invalid timestamp: leap seconds are not allowed: "
                        + CivilTimeTextUtils.printString(in),
                    secondStart);
            }

            // -00:00 is an unknown local offset
            boolean unknownOffset = offsetSign < 0 && offsetHours == 0 && offsetMinutes == 0;
            ZoneOffset offset;
            try
            {
                offset = unknownOffset
                    ? ZoneOffset.ZERO
                    : ZoneOffset.of(offsetSign, offsetHours, offsetMinutes);
            }
            catch (CivilTimeException e)
            {
                throw fail(in, offsetStart, e);
            }

            Timestamp ts;
            try
            {
                ts = Timestamp.fromLocalDateTimeOffset(date, time, offset);
            }
            catch (CivilTimeException e)
            {
                throw fail(in, 0, e);
            }
            return unknownOffset ? ts.withUnknownLocalOffset() : ts;
        }

        @Override
        public String toString()
        {
            return "TimestampReader{leapSecondsAllowed=" + myLeapSecondsAllowed
                + ", lowercaseDesignatorsAllowed=" + myLowercaseAllowed + "}";
        }
    }


    //=========================================================================
    // Writing

    private static void printDigits(Appendable out, int value, int length)
        throws IOException
    {
        char[] temp = new char[length];
        while (length > 0) {
            length--;
            int next = value / 10;
            temp[length] = (char) ('0' + (value - next * 10));
            value = next;
        }
        out.append(new String(temp));
    }

    /**
     * Prints whole seconds as two digits, then the fraction with exactly the
     * scale of the value.
     */
    private static void printSeconds(Appendable out, BigDecimal second)
        throws IOException
    {
        if (second.scale() < 0)
        {
            second = second.setScale(0);
        }
        int whole = second.intValue();
        printDigits(out, whole, 2);
        if (second.scale() > 0)
        {
            String fraction = second.subtract(BigDecimal.valueOf(whole)).toPlainString();
            // fraction is "0.ddd"
            out.append(fraction, 1, fraction.length());
        }
    }

    private static void printOffset(Appendable out, Integer offset, boolean zuluForZeroOffset)
        throws IOException
    {
        if (offset == null)
        {
            out.append("-00:00");
            return;
        }
        int min = offset.intValue();
        if (min == 0 && zuluForZeroOffset)
        {
            out.append('Z');
            return;
        }
        if (min < 0)
        {
            min = -min;
            out.append('-');
        }
        else
        {
            out.append('+');
        }
        int hour = min / 60;
        min = min - hour * 60;
        printDigits(out, hour, 2);
        out.append(':');
        printDigits(out, min, 2);
    }


    private static final class TextWriter
        implements TimestampWriter
    {
        private final boolean myUtcOutput;
        private final boolean myZuluForZeroOffset;

        TextWriter(boolean utcOutput, boolean zuluForZeroOffset)
        {
            myUtcOutput = utcOutput;
            myZuluForZeroOffset = zuluForZeroOffset;
        }

        public void write(Timestamp value, Appendable out)
            throws IOException
        {
            Date date;
            TimeOfDay time;
            Integer offset;
            if (myUtcOutput)
            {
                date = value.getUtcDate();
                time = value.getUtcTimeOfDay();
                offset = Timestamp.UTC_OFFSET;
            }
            else
            {
                date = value.getLocalDate();
                time = value.getLocalTimeOfDay();
                offset = value.getLocalOffsetMinutes();
            }

            printDigits(out, date.getYear(), 4);
            out.append('-');
            printDigits(out, date.getMonth(), 2);
            out.append('-');
            printDigits(out, date.getDay(), 2);
            out.append('T');
            printDigits(out, time.getHour(), 2);
            out.append(':');
            printDigits(out, time.getMinute(), 2);
            out.append(':');
            printSeconds(out, time.getSecond());
            printOffset(out, offset, myZuluForZeroOffset);
        }

        public String format(Timestamp value)
        {
            StringBuilder buffer = new StringBuilder(32);
            try
            {
                write(value, buffer);
            }
            catch (IOException e)
            {
                throw new RuntimeException("Exception printing to StringBuilder",
                                           e);
            }
            return buffer.toString();
        }

        @Override
        public String toString()
        {
            return "TimestampWriter{utcOutput=" + myUtcOutput
                + ", zuluForZeroOffset=" + myZuluForZeroOffset + "}";
        }
    }
}
