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

package org.conneg.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Fast String Utilities.
 *
 * These string utilities avoid object creation unless absolutely required
 * and only fold the case of US-ASCII characters, as is appropriate for
 * HTTP tokens.
 */
public class StringUtil
{
    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param c the char to convert
     * @return a lower case version of c
     */
    public static char asciiToLowerCase(char c)
    {
        return (c >= 'A' && c <= 'Z') ? (char)(c + ('a' - 'A')) : c;
    }

    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param s the string to convert
     * @return a lower case version of s, or s itself if it has no upper case ascii characters
     */
    public static String asciiToLowerCase(String s)
    {
        if (s == null)
            return null;

        char[] c = null;
        int i = s.length();
        // look for first conversion
        while (i-- > 0)
        {
            char c1 = s.charAt(i);
            char c2 = asciiToLowerCase(c1);
            if (c1 != c2)
            {
                c = s.toCharArray();
                c[i] = c2;
                break;
            }
        }
        while (i-- > 0)
        {
            c[i] = asciiToLowerCase(c[i]);
        }

        return c == null ? s : new String(c);
    }

    /**
     * Test if every character of a string is an ascii digit.
     *
     * @param str the string to test
     * @param offset the index of the first character to test
     * @param length the number of characters to test
     * @return true if the range is non-empty and holds only the characters {@code 0-9}
     */
    public static boolean isDigits(String str, int offset, int length)
    {
        if (length <= 0 || offset + length > str.length())
            return false;
        for (int i = offset; i < offset + length; i++)
        {
            char c = str.charAt(i);
            if (c < '0' || c > '9')
                return false;
        }
        return true;
    }

    /**
     * Split a comma separated list, trimming whitespace around each
     * element and dropping empty elements.
     * <p>No quoting is supported, so this is only suitable for lists of tokens.</p>
     *
     * @param s the list to split, may be null
     * @return the non empty trimmed elements, never null
     */
    public static List<String> csvSplit(String s)
    {
        List<String> list = new ArrayList<>();
        if (s == null)
            return list;

        int start = 0;
        while (start <= s.length())
        {
            int comma = s.indexOf(',', start);
            int end = comma < 0 ? s.length() : comma;
            String element = s.substring(start, end).trim();
            if (!element.isEmpty())
                list.add(element);
            start = end + 1;
        }
        return list;
    }
}
