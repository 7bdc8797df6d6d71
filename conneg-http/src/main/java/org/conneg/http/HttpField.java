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

import org.conneg.util.StringUtil;

/**
 * An immutable HTTP Field.
 */
public class HttpField
{
    private final HttpHeader _header;
    private final String _name;
    private final String _value;

    public HttpField(HttpHeader header, String name, String value)
    {
        _header = header;
        _name = Objects.requireNonNull(name, "name");
        _value = value;
    }

    public HttpField(HttpHeader header, String value)
    {
        this(header, header.asString(), value);
    }

    public HttpField(String name, String value)
    {
        this(HttpHeader.lookup(name), name, value);
    }

    /**
     * @return the known header, or null if the field name is not a known header
     */
    public HttpHeader getHeader()
    {
        return _header;
    }

    public String getName()
    {
        return _name;
    }

    public String getLowerCaseName()
    {
        return _header != null ? _header.lowerCaseName() : StringUtil.asciiToLowerCase(_name);
    }

    public String getValue()
    {
        return _value;
    }

    /**
     * @param name the name to test
     * @return true if this field has the given case insensitive name
     */
    public boolean is(String name)
    {
        return _name.equalsIgnoreCase(name);
    }

    public boolean isSameName(HttpField field)
    {
        if (field == null)
            return false;
        if (field == this)
            return true;
        if (_header != null && _header == field.getHeader())
            return true;
        return _name.equalsIgnoreCase(field.getName());
    }

    /**
     * Look for a token in a possibly multi valued field.
     *
     * @param search the token to search for (case insensitive)
     * @return True iff the token is the whole field value or an element of its comma separated list,
     * ignoring any parameters of the element.
     */
    public boolean contains(String search)
    {
        if (search == null)
            return _value == null;
        if (search.isEmpty() || _value == null)
            return false;

        for (String element : StringUtil.csvSplit(_value))
        {
            int semi = element.indexOf(';');
            String token = semi < 0 ? element : element.substring(0, semi).trim();
            if (token.equalsIgnoreCase(search))
                return true;
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(getLowerCaseName(), _value);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof HttpField))
            return false;
        HttpField field = (HttpField)o;
        return isSameName(field) && Objects.equals(_value, field.getValue());
    }

    @Override
    public String toString()
    {
        String v = getValue();
        return getName() + ": " + (v == null ? "" : v);
    }
}
