// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.system;

import com.amazon.civiltime.Timestamp;
import com.amazon.civiltime.TimestampReader;
import com.amazon.civiltime.impl._Private_TimestampReaderBuilder;
import com.amazon.civiltime.impl._Private_TimestampText;

/**
 * Builds {@link TimestampReader}s, which read RFC 3339 style text such as
 * {@code 2016-12-31T23:59:60.5Z} into {@link Timestamp}s.
 *
 * <h2>Obtaining and Usage</h2>
 * A builder with the default configuration, which accepts leap seconds and
 * lowercase {@code t} and {@code z} designators, is obtained as follows.
 * <pre>
 * TimestampReaderBuilder readerBuilder = TimestampReaderBuilder.standard();
 * </pre>
 * Builders are configured by chaining calls to {@code with*()} methods:
 * <pre>
 * TimestampReader reader = TimestampReaderBuilder.standard()
 *     .withLeapSecondsAllowed(false)
 *     .build();
 * Timestamp ts = reader.read("2023-06-30T23:59:59.5+02:00");
 * </pre>
 * The readers built are immutable and thread-safe; the builders are not,
 * unless made {@link #immutable()}.
 */
public abstract class TimestampReaderBuilder
{
    private boolean isLeapSecondsAllowed = true;
    private boolean isLowercaseDesignatorsAllowed = true;

    protected TimestampReaderBuilder()
    {
    }

    protected TimestampReaderBuilder(TimestampReaderBuilder that)
    {
        this.isLeapSecondsAllowed = that.isLeapSecondsAllowed;
        this.isLowercaseDesignatorsAllowed = that.isLowercaseDesignatorsAllowed;
    }

    /**
     * The standard builder of {@link TimestampReader}s, with all
     * configuration properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static TimestampReaderBuilder standard()
    {
        return new _Private_TimestampReaderBuilder.Mutable();
    }

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public TimestampReaderBuilder copy()
    {
        return new _Private_TimestampReaderBuilder.Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public TimestampReaderBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public TimestampReaderBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    /**
     * Declares whether built readers accept a seconds field of 60 on days
     * that may hold a positive leap second. When disabled, any seconds field
     * of 60 or more is rejected with
     * {@link com.amazon.civiltime.ErrorKind#INVALID_LEAP_SECOND}.
     * By default, leap seconds are allowed.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setLeapSecondsAllowed(boolean)
     */
    public TimestampReaderBuilder withLeapSecondsAllowed(boolean allowed)
    {
        TimestampReaderBuilder b = mutable();
        b.setLeapSecondsAllowed(allowed);
        return b;
    }

    /**
     * @see #withLeapSecondsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setLeapSecondsAllowed(boolean allowed)
    {
        mutationCheck();
        this.isLeapSecondsAllowed = allowed;
    }

    /**
     * @see #withLeapSecondsAllowed(boolean)
     */
    public boolean isLeapSecondsAllowed()
    {
        return isLeapSecondsAllowed;
    }

    /**
     * Declares whether built readers accept the lowercase designators
     * {@code t} and {@code z}, which RFC 3339 permits in place of
     * {@code T} and {@code Z}. By default, they are allowed.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setLowercaseDesignatorsAllowed(boolean)
     */
    public TimestampReaderBuilder withLowercaseDesignatorsAllowed(boolean allowed)
    {
        TimestampReaderBuilder b = mutable();
        b.setLowercaseDesignatorsAllowed(allowed);
        return b;
    }

    /**
     * @see #withLowercaseDesignatorsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setLowercaseDesignatorsAllowed(boolean allowed)
    {
        mutationCheck();
        this.isLowercaseDesignatorsAllowed = allowed;
    }

    /**
     * @see #withLowercaseDesignatorsAllowed(boolean)
     */
    public boolean isLowercaseDesignatorsAllowed()
    {
        return isLowercaseDesignatorsAllowed;
    }


    /**
     * Builds a reader with this builder's configuration.
     */
    public TimestampReader build()
    {
        return _Private_TimestampText.newReader(isLeapSecondsAllowed,
                                                isLowercaseDesignatorsAllowed);
    }
}
