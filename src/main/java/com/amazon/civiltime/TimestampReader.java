// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime;

import com.amazon.civiltime.system.TimestampReaderBuilder;

/**
 * Reads {@link Timestamp}s from text. Instances are immutable and may be
 * shared between threads.
 * <p>
 * Implementations of this interface are provided by
 * {@link TimestampReaderBuilder}.
 */
public interface TimestampReader
{
    /**
     * Reads the whole of {@code text} as a single timestamp.
     *
     * @throws TimestampParseException if the text is not a supported
     *          timestamp.
     * @throws NullPointerException if {@code text} is null.
     */
    public Timestamp read(CharSequence text);
}
