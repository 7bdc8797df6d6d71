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

import java.util.HashMap;
import java.util.Map;

import org.conneg.util.StringUtil;

/**
 * The HTTP header names involved in content-coding negotiation.
 */
public enum HttpHeader
{
    /**
     * Entity Fields.
     */
    CONTENT_ENCODING("Content-Encoding"),
    CONTENT_TYPE("Content-Type"),

    /**
     * Request Fields.
     */
    ACCEPT("Accept"),
    ACCEPT_ENCODING("Accept-Encoding"),

    /**
     * Response Fields.
     */
    VARY("Vary");

    private static final Map<String, HttpHeader> CACHE = new HashMap<>();

    static
    {
        for (HttpHeader header : HttpHeader.values())
        {
            CACHE.put(StringUtil.asciiToLowerCase(header.asString()), header);
        }
    }

    /**
     * Look up a known header by its case insensitive name.
     *
     * @param name the header name
     * @return the known header or null
     */
    public static HttpHeader lookup(String name)
    {
        if (name == null)
            return null;
        return CACHE.get(StringUtil.asciiToLowerCase(name));
    }

    private final String _string;
    private final String _lowerCase;

    HttpHeader(String s)
    {
        _string = s;
        _lowerCase = StringUtil.asciiToLowerCase(s);
    }

    public String lowerCaseName()
    {
        return _lowerCase;
    }

    public String asString()
    {
        return _string;
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
