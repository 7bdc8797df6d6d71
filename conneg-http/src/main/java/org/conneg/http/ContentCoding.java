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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.conneg.util.StringUtil;

/**
 * A content-coding, the name of a transformation applied to a representation.
 * <p>
 * The codings {@link #GZIP}, {@link #DEFLATE}, {@link #BR}, {@link #ZSTD} and
 * {@link #IDENTITY} are known.  Any other valid token may be represented as an
 * unrecognized coding, for which {@link #isKnown()} returns false.  Codings are
 * case insensitive and compare equal by their lower case token.
 * </p>
 *
 * @see "https://tools.ietf.org/html/rfc7231#section-3.1.2.1"
 */
public final class ContentCoding
{
    private static final Map<String, ContentCoding> KNOWN = new LinkedHashMap<>();

    public static final ContentCoding GZIP = known("gzip");
    public static final ContentCoding DEFLATE = known("deflate");
    public static final ContentCoding BR = known("br");
    public static final ContentCoding ZSTD = known("zstd");
    public static final ContentCoding IDENTITY = known("identity");

    private static ContentCoding known(String token)
    {
        ContentCoding coding = new ContentCoding(token, true);
        KNOWN.put(token, coding);
        return coding;
    }

    /**
     * @return the known codings, in declaration order
     */
    public static Map<String, ContentCoding> getKnown()
    {
        return Collections.unmodifiableMap(KNOWN);
    }

    /**
     * Look up a known coding.
     *
     * @param token the case insensitive coding name
     * @return the known coding, or null if the token is not a known coding
     */
    public static ContentCoding lookup(String token)
    {
        if (token == null)
            return null;
        return KNOWN.get(StringUtil.asciiToLowerCase(token));
    }

    /**
     * Get the coding for a token, which need not be known.
     *
     * @param token the case insensitive coding name
     * @return a known coding or an unrecognized coding carrying the lower case token
     * @throws IllegalArgumentException if the token is not a valid RFC7230 token or is the wildcard
     */
    public static ContentCoding from(String token)
    {
        ContentCoding coding = lookup(token);
        if (coding != null)
            return coding;
        Syntax.requireValidRFC7230Token(token, "Content coding");
        if ("*".equals(token))
            throw new IllegalArgumentException("Content coding: wildcard is not a coding");
        return new ContentCoding(StringUtil.asciiToLowerCase(token), false);
    }

    private final String _token;
    private final boolean _known;

    private ContentCoding(String token, boolean known)
    {
        _token = token;
        _known = known;
    }

    public String asString()
    {
        return _token;
    }

    public boolean isKnown()
    {
        return _known;
    }

    /**
     * @param token the token to test
     * @return true if the token names this coding, ignoring case
     */
    public boolean is(String token)
    {
        return _token.equalsIgnoreCase(token);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof ContentCoding))
            return false;
        return _token.equals(((ContentCoding)o)._token);
    }

    @Override
    public int hashCode()
    {
        return _token.hashCode();
    }

    @Override
    public String toString()
    {
        return _token;
    }
}
