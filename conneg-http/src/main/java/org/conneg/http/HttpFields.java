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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An ordered collection of {@link HttpField}s that may contain several
 * fields of the same name.
 * <p>
 * The field order is the order in which the fields were added, which for a
 * header that is repeated is also the order in which its values must be
 * combined.
 * </p>
 */
public interface HttpFields extends Iterable<HttpField>
{
    static Mutable build()
    {
        return new Mutable();
    }

    static Mutable build(HttpFields fields)
    {
        return new Mutable(fields);
    }

    default Stream<HttpField> stream()
    {
        return StreamSupport.stream(spliterator(), false);
    }

    int size();

    /**
     * Get a Field by index.
     *
     * @param index the field index
     * @return A Field value
     * @throws NoSuchElementException if the index is out of range
     */
    HttpField getField(int index);

    default HttpField getField(HttpHeader header)
    {
        for (HttpField f : this)
        {
            if (f.getHeader() == header)
                return f;
        }
        return null;
    }

    default HttpField getField(String name)
    {
        for (HttpField f : this)
        {
            if (f.is(name))
                return f;
        }
        return null;
    }

    default List<HttpField> getFields(HttpHeader header)
    {
        return stream().filter(f -> f.getHeader() == header).collect(Collectors.toList());
    }

    default boolean contains(HttpHeader header)
    {
        return getField(header) != null;
    }

    default boolean contains(HttpHeader header, String value)
    {
        for (HttpField f : this)
        {
            if (f.getHeader() == header && f.contains(value))
                return true;
        }
        return false;
    }

    default boolean contains(String name)
    {
        return getField(name) != null;
    }

    default String get(HttpHeader header)
    {
        HttpField field = getField(header);
        return field == null ? null : field.getValue();
    }

    default String get(String name)
    {
        HttpField field = getField(name);
        return field == null ? null : field.getValue();
    }

    /**
     * Get the values of every field with the given header, in field order.
     *
     * @param header the header
     * @return the values, or an empty list if the header is not present
     */
    default List<String> getValuesList(HttpHeader header)
    {
        List<String> list = null;
        for (HttpField f : this)
        {
            if (f.getHeader() == header)
            {
                if (list == null)
                    list = new ArrayList<>();
                list.add(f.getValue());
            }
        }
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Get the values of every field with the given name, in field order.
     *
     * @param name the case-insensitive field name
     * @return the values, or an empty list if the header is not present
     */
    default List<String> getValuesList(String name)
    {
        List<String> list = null;
        for (HttpField f : this)
        {
            if (f.is(name))
            {
                if (list == null)
                    list = new ArrayList<>();
                list.add(f.getValue());
            }
        }
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * HTTP Fields that may be added to and removed from.
     * <p>This class is not synchronized as it is expected that modifications will only be performed by a
     * single thread.</p>
     */
    class Mutable implements HttpFields
    {
        private final List<HttpField> _fields;

        protected Mutable()
        {
            _fields = new ArrayList<>();
        }

        protected Mutable(HttpFields fields)
        {
            _fields = new ArrayList<>(fields.size());
            for (HttpField field : fields)
            {
                _fields.add(field);
            }
        }

        @Override
        public int size()
        {
            return _fields.size();
        }

        @Override
        public HttpField getField(int index)
        {
            if (index < 0 || index >= _fields.size())
                throw new NoSuchElementException();
            return _fields.get(index);
        }

        @Override
        public Iterator<HttpField> iterator()
        {
            return _fields.iterator();
        }

        public Mutable add(HttpField field)
        {
            _fields.add(Objects.requireNonNull(field));
            return this;
        }

        public Mutable add(HttpHeader header, String value)
        {
            return add(new HttpField(header, value));
        }

        public Mutable add(String name, String value)
        {
            return add(new HttpField(name, value));
        }

        /**
         * Set a field, replacing the first existing field of the same name and
         * removing any others.
         *
         * @param field the field to set
         * @return this
         */
        public Mutable put(HttpField field)
        {
            Objects.requireNonNull(field);
            boolean put = false;
            for (ListIterator<HttpField> i = _fields.listIterator(); i.hasNext(); )
            {
                HttpField f = i.next();
                if (f.isSameName(field))
                {
                    if (put)
                        i.remove();
                    else
                    {
                        i.set(field);
                        put = true;
                    }
                }
            }
            if (!put)
                _fields.add(field);
            return this;
        }

        public Mutable put(HttpHeader header, String value)
        {
            if (value == null)
                return remove(header);
            return put(new HttpField(header, value));
        }

        public Mutable put(String name, String value)
        {
            if (value == null)
                return remove(name);
            return put(new HttpField(name, value));
        }

        public Mutable remove(HttpHeader header)
        {
            _fields.removeIf(f -> f.getHeader() == header);
            return this;
        }

        public Mutable remove(String name)
        {
            _fields.removeIf(f -> f.is(name));
            return this;
        }

        public Mutable clear()
        {
            _fields.clear();
            return this;
        }

        @Override
        public int hashCode()
        {
            return _fields.hashCode();
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o)
                return true;
            if (!(o instanceof Mutable))
                return false;
            return _fields.equals(((Mutable)o)._fields);
        }

        @Override
        public String toString()
        {
            StringBuilder buffer = new StringBuilder();
            for (HttpField field : _fields)
            {
                buffer.append(field).append("\r\n");
            }
            buffer.append("\r\n");
            return buffer.toString();
        }
    }
}
