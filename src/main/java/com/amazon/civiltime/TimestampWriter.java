// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import com.amazon.civiltime.system.TimestampWriterBuilder;
import java.io.IOException;

/**
 * Writes {@link Timestamp}s as text. Instances are immutable and may be
 * shared between threads.
 * <p>
 * Implementations of this interface are provided by
 * {@link TimestampWriterBuilder}.
 */
public interface TimestampWriter
{
    /**
     * Appends the text of {@code value} to {@code out}.
     *
     * @throws IOException propagated when the {@link Appendable} throws it.
     */
    public void write(Timestamp value, Appendable out)
        throws IOException;

    /**
     * Returns the text of {@code value}.
     */
    public String format(Timestamp value);
}
