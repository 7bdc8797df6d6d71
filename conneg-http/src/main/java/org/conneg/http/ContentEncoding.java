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

import java.util.List;
import java.util.Objects;

/**
 * The {@code Content-Encoding} of a representation, as chosen by
 * {@link AcceptEncoding#negotiate(List)}.
 *
 * @see "https://tools.ietf.org/html/rfc7231#section-3.1.2.2"
 */
public class ContentEncoding
{
    /**
     * Read the {@code Content-Encoding} of a set of fields.
     * <p>
     * When several codings are listed, the last one is returned as it is the
     * coding that was applied last.
     * </p>
     *
     * @param fields the fields to read
     * @return the content encoding, or null if the fields have no {@code Content-Encoding}
     * @throws IllegalArgumentException if the header is present but does not name a valid coding
     */
    public static ContentEncoding from(HttpFields fields)
    {
        List<String> values = fields.getValuesList(HttpHeader.CONTENT_ENCODING);
        if (values.isEmpty())
            return null;

        String last = null;
        for (String value : values)
        {
            if (value == null)
                continue;
            for (String token : value.split(","))
            {
                token = token.trim();
                if (!token.isEmpty())
                    last = token;
            }
        }
        if (last == null)
            throw new IllegalArgumentException("Empty " + HttpHeader.CONTENT_ENCODING);
        return new ContentEncoding(ContentCoding.from(last));
    }

    private final ContentCoding _coding;

    public ContentEncoding(ContentCoding coding)
    {
        _coding = Objects.requireNonNull(coding, "coding");
    }

    public ContentCoding getCoding()
    {
        return _coding;
    }

    public boolean is(ContentCoding coding)
    {
        return _coding.equals(coding);
    }

    public HttpHeader getName()
    {
        return HttpHeader.CONTENT_ENCODING;
    }

    public String getValue()
    {
        return _coding.asString();
    }

    /**
     * Set the {@code Content-Encoding} header, replacing any existing value.
     *
     * @param fields the fields to update
     */
    public void apply(HttpFields.Mutable fields)
    {
        fields.put(getName(), getValue());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof ContentEncoding))
            return false;
        return _coding.equals(((ContentEncoding)o)._coding);
    }

    @Override
    public int hashCode()
    {
        return _coding.hashCode();
    }

    @Override
    public String toString()
    {
        return getName() + ": " + getValue();
    }
}
