// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.civiltime.util;

import java.io.IOException;

/**
 * Utility methods for quoting text in diagnostics, so that the input that
 * caused a failure is shown unambiguously and ASCII-safe.
 */
public final class CivilTimeTextUtils
{
    private CivilTimeTextUtils() { }

    private static final String[] ZERO_PADDING =
    {
        "",
        "0",
        "00",
        "000",
        "0000",
        "00000",
        "000000",
        "0000000",
    };


    /**
     * Prints a single code point, ASCII safe, escaping double quotes and
     * backslashes.
     */
    private static void printCodePoint(Appendable out, int c)
        throws IOException
    {
        switch (c) {
            case 0:
                out.append("\\0");
                return;
            case '\t':
                out.append("\\t");
                return;
            case '\n':
                out.append("\\n");
                return;
            case '\r':
                out.append("\\r");
                return;
            case '\"':
                out.append("\\\"");
                return;
            case '\\':
                out.append("\\\\");
                return;
            default:
                break;
        }

        if (c < 32 || (c >= 0x7F && c <= 0xFF)) {
            printCodePointAsHexDigits(out, "\\x", c, 2);
        }
        else if (c < 0x7F) {  // Printable ASCII
            out.append((char) c);
        }
        else if (c <= 0xFFFF) {
            printCodePointAsHexDigits(out, "\\u", c, 4);
        }
        else {
            printCodePointAsHexDigits(out, "\\U", c, 8);
        }
    }

    /**
     * Generates a hex escape sequence using lower-case for alphabetics.
     */
    private static void printCodePointAsHexDigits(Appendable out, String prefix, int c, int width)
        throws IOException
    {
        String s = Integer.toHexString(c);
        out.append(prefix);
        out.append(ZERO_PADDING[width - s.length()]);
        out.append(s);
    }


    /**
     * Prints characters as an ASCII-encoded string, including surrounding
     * double-quotes. If the {@code text} is null, this prints {@code null}.
     *
     * @param out the stream to receive the data.
     * @param text the text to print; may be {@code null}.
     *
     * @throws IOException if the {@link Appendable} throws an exception.
     */
    public static void printString(Appendable out, CharSequence text)
        throws IOException
    {
        if (text == null)
        {
            out.append("null");
            return;
        }

        out.append('"');
        int len = text.length();
        for (int i = 0; i < len; )
        {
            int c = Character.codePointAt(text, i);
            printCodePoint(out, c);
            i += Character.charCount(c);
        }
        out.append('"');
    }

    /**
     * Builds a String denoting an ASCII-encoded string, including surrounding
     * double-quotes. If the {@code text} is null, this returns {@code "null"}.
     *
     * @param text the text to print; may be {@code null}.
     */
    public static String printString(CharSequence text)
    {
        if (text == null)
        {
            return "null";
        }

        StringBuilder builder = new StringBuilder(text.length() + 2);
        try
        {
            printString(builder, text);
        }
        catch (IOException e)
        {
            // Shouldn't happen
            throw new Error(e);
        }
        return builder.toString();
    }

    /**
     * Builds a String denoting an ASCII-encoded string,
     * with double-quotes surrounding a single Unicode code point.
     *
     * @param codePoint a Unicode code point.
     */
    public static String printCodePointAsString(int codePoint)
    {
        StringBuilder builder = new StringBuilder(12);
        builder.append('"');
        try
        {
            printCodePoint(builder, codePoint);
        }
        catch (IOException e)
        {
            // Shouldn't happen
            throw new Error(e);
        }
        builder.append('"');
        return builder.toString();
    }
}
