//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.conneg.http;

import java.util.Objects;

/**
 * Collection of Syntax validation methods.
 * <p>
 * Use in a similar way as you would {@link java.util.Objects#requireNonNull(Object)}
 * </p>
 */
public final class Syntax
{
    /**
     * Per RFC7230: Section 3.2.6, a token follows these syntax rules
     * <pre>
     *  token          = 1*tchar
     *  tchar          = "!" / "#" / "$" / "%" / "&amp;" / "'" / "*"
     *                 / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~"
     *                 / DIGIT / ALPHA
     * </pre>
     *
     * @param c the character to test
     * @return true if the character may appear in a token
     */
    public static boolean isTChar(char c)
    {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))
            return true;
        switch (c)
        {
            case '!':
            case '#':
            case '$':
            case '%':
            case '&':
            case '\'':
            case '*':
            case '+':
            case '-':
            case '.':
            case '^':
            case '_':
            case '`':
            case '|':
            case '~':
                return true;
            default:
                return false;
        }
    }

    /**
     * Require a value to be a non empty RFC7230 token.
     *
     * @param value the value to test
     * @param msg the message to be prefixed if an {@link IllegalArgumentException} is thrown.
     * @return the value
     * @throws IllegalArgumentException if the value is invalid per RFC7230
     */
    public static String requireValidRFC7230Token(String value, String msg)
    {
        Objects.requireNonNull(msg, "msg cannot be null");

        if (value == null || value.isEmpty())
            throw new IllegalArgumentException(msg + ": RFC7230 tokens may not be empty");

        int valueLen = value.length();
        for (int i = 0; i < valueLen; i++)
        {
            char c = value.charAt(i);

            // 0x00 - 0x1F are low order control characters
            // 0x7F is the DEL control character
            if ((c <= 0x1F) || (c == 0x7F))
                throw new IllegalArgumentException(msg + ": RFC7230 tokens may not contain control characters");
            if (c >= 0x80)
                throw new IllegalArgumentException(msg + ": RFC7230 tokens characters restricted to US-ASCII: 0x" + Integer.toHexString(c));
            if (!isTChar(c))
                throw new IllegalArgumentException(msg + ": RFC7230 tokens may not contain separator character: [" + c + "]");
        }
        return value;
    }

    private Syntax()
    {
    }
}
