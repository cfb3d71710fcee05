// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.system;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.amazon.civiltime.Timestamp;
import com.amazon.civiltime.TimestampWriter;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class TimestampWriterBuilderTest
{

    @Rule
    public ExpectedException thrown = ExpectedException.none();

    @Test
    public void testDefaults()
    {
        TimestampWriterBuilder builder = TimestampWriterBuilder.standard();
        assertFalse(builder.isUtcOutput());
        assertTrue(builder.isZuluForZeroOffset());
    }

    @Test
    public void testImmutable()
    {
        TimestampWriterBuilder mutable = TimestampWriterBuilder.standard().withUtcOutput(true);
        TimestampWriterBuilder immutable = mutable.immutable();
        assertSame(mutable, mutable.withUtcOutput(false));
        assertFalse(mutable.isUtcOutput());
        assertTrue(immutable.isUtcOutput());
        assertSame(immutable, immutable.immutable());
        assertNotSame(immutable, immutable.copy());
    }

    @Test
    public void testMutatingImmutableFails()
    {
        TimestampWriterBuilder immutable = TimestampWriterBuilder.standard().immutable();
        thrown.expect(UnsupportedOperationException.class);
        immutable.setZuluForZeroOffset(false);
    }

    @Test
    public void testLocalOutput() throws IOException
    {
        TimestampWriter writer = TimestampWriterBuilder.standard().build();
        Timestamp ts = Timestamp.valueOf("2024-01-01T00:59:60.5+01:00");
        assertEquals("2024-01-01T00:59:60.5+01:00", writer.format(ts));

        StringBuilder out = new StringBuilder("at ");
        writer.write(ts, out);
        assertEquals("at 2024-01-01T00:59:60.5+01:00", out.toString());
    }

    @Test
    public void testUtcOutput()
    {
        TimestampWriter writer = TimestampWriterBuilder.standard().withUtcOutput(true).build();
        assertEquals("2023-12-31T23:59:60.5Z",
                     writer.format(Timestamp.valueOf("2024-01-01T00:59:60.5+01:00")));
        assertEquals("2023-12-31T23:00:00Z",
                     writer.format(Timestamp.valueOf("2023-12-31T23:00:00-00:00")));
    }

    @Test
    public void testZeroOffsetWithoutZulu()
    {
        TimestampWriter writer = TimestampWriterBuilder.standard()
            .withZuluForZeroOffset(false)
            .build();
        assertEquals("2023-12-31T23:00:00+00:00",
                     writer.format(Timestamp.valueOf("2023-12-31T23:00:00Z")));
        // Unknown offsets are always -00:00.
        assertEquals("2023-12-31T23:00:00-00:00",
                     writer.format(Timestamp.valueOf("2023-12-31T23:00:00-00:00")));

        writer = TimestampWriterBuilder.standard()
            .withZuluForZeroOffset(false)
            .withUtcOutput(true)
            .build();
        assertEquals("2023-12-31T22:00:00+00:00",
                     writer.format(Timestamp.valueOf("2023-12-31T23:00:00+01:00")));
    }
}
