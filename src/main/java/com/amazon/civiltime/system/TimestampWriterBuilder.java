// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.system;

import com.amazon.civiltime.Timestamp;
import com.amazon.civiltime.TimestampWriter;
import com.amazon.civiltime.impl._Private_TimestampText;
import com.amazon.civiltime.impl._Private_TimestampWriterBuilder;

/**
 * Builds {@link TimestampWriter}s, which print {@link Timestamp}s in the
 * form {@code yyyy-mm-ddThh:mm:ss[.fff]offset}.
 * <p>
 * By default, the local date and time are printed followed by the local
 * offset, with {@code Z} for a zero offset and {@code -00:00} for an unknown
 * one. The fractional seconds are printed with exactly the precision the
 * timestamp carries.
 * <pre>
 * TimestampWriter writer = TimestampWriterBuilder.standard()
 *     .withUtcOutput(true)
 *     .build();
 * writer.format(Timestamp.fromString("2023-06-01T08:30:00-07:00")); // 2023-06-01T15:30:00Z
 * </pre>
 */
public abstract class TimestampWriterBuilder
{
    private boolean isUtcOutput = false;
    private boolean isZuluForZeroOffset = true;

    protected TimestampWriterBuilder()
    {
    }

    protected TimestampWriterBuilder(TimestampWriterBuilder that)
    {
        this.isUtcOutput = that.isUtcOutput;
        this.isZuluForZeroOffset = that.isZuluForZeroOffset;
    }

    /**
     * The standard builder of {@link TimestampWriter}s, with all
     * configuration properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static TimestampWriterBuilder standard()
    {
        return new _Private_TimestampWriterBuilder.Mutable();
    }

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public TimestampWriterBuilder copy()
    {
        return new _Private_TimestampWriterBuilder.Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public TimestampWriterBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public TimestampWriterBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    /**
     * Declares whether built writers print the UTC date and time, always
     * followed by a zero offset, instead of the local ones.
     * By default, the local date and time are printed.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setUtcOutput(boolean)
     */
    public TimestampWriterBuilder withUtcOutput(boolean utc)
    {
        TimestampWriterBuilder b = mutable();
        b.setUtcOutput(utc);
        return b;
    }

    /**
     * @see #withUtcOutput(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setUtcOutput(boolean utc)
    {
        mutationCheck();
        this.isUtcOutput = utc;
    }

    /**
     * @see #withUtcOutput(boolean)
     */
    public boolean isUtcOutput()
    {
        return isUtcOutput;
    }

    /**
     * Declares whether built writers print a zero offset as {@code Z} rather
     * than {@code +00:00}. By default, {@code Z} is printed.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setZuluForZeroOffset(boolean)
     */
    public TimestampWriterBuilder withZuluForZeroOffset(boolean zulu)
    {
        TimestampWriterBuilder b = mutable();
        b.setZuluForZeroOffset(zulu);
        return b;
    }

    /**
     * @see #withZuluForZeroOffset(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setZuluForZeroOffset(boolean zulu)
    {
        mutationCheck();
        this.isZuluForZeroOffset = zulu;
    }

    /**
     * @see #withZuluForZeroOffset(boolean)
     */
    public boolean isZuluForZeroOffset()
    {
        return isZuluForZeroOffset;
    }


    /**
     * Builds a writer with this builder's configuration.
     */
    public TimestampWriter build()
    {
        return _Private_TimestampText.newWriter(isUtcOutput, isZuluForZeroOffset);
    }
}
