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
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.stream.Stream;

import org.conneg.util.WeightedSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The content codings a client will accept, as advertised by an
 * {@code Accept-Encoding} request header.
 * <p>
 * Entries are kept in the order they were declared or pushed until
 * {@link #sort()} or {@link #negotiate(List)} is called.  The wildcard
 * directive {@code *} is held as a flag rather than as an entry.
 * </p>
 * <p>This class is not synchronized; an instance belongs to a single request.</p>
 *
 * @see "https://tools.ietf.org/html/rfc7231#section-5.3.4"
 */
public class AcceptEncoding implements Iterable<EncodingProposal>
{
    private static final Logger LOG = LoggerFactory.getLogger(AcceptEncoding.class);

    /**
     * Parse the {@code Accept-Encoding} fields of a request.
     *
     * @param fields the request fields
     * @return the accepted encodings, or null if the fields contain no {@code Accept-Encoding} header
     * @throws IllegalArgumentException if a directive has a malformed or out of range weight
     * @see #from(List)
     */
    public static AcceptEncoding from(HttpFields fields)
    {
        if (!fields.contains(HttpHeader.ACCEPT_ENCODING))
            return null;
        return from(fields.getValuesList(HttpHeader.ACCEPT_ENCODING));
    }

    /**
     * Parse a single {@code Accept-Encoding} header value.
     *
     * @param value the header value
     * @return the accepted encodings
     * @throws IllegalArgumentException if a directive has a malformed or out of range weight
     */
    public static AcceptEncoding from(String value)
    {
        return from(Collections.singletonList(value));
    }

    /**
     * Parse the values of one or more {@code Accept-Encoding} headers as if
     * they were a single comma separated value.
     * <p>
     * Empty directives are ignored, as are directives naming a coding that is not
     * {@link ContentCoding#isKnown() known}. A malformed weight fails the whole value.
     * </p>
     *
     * @param values the header values in the order they were received
     * @return the accepted encodings, which may be empty
     * @throws IllegalArgumentException if a directive has a malformed or out of range weight
     */
    public static AcceptEncoding from(List<String> values)
    {
        AcceptEncoding accept = new AcceptEncoding();
        for (String value : values)
        {
            if (value == null)
                continue;
            for (String directive : value.split(","))
            {
                directive = directive.trim();
                if (directive.isEmpty())
                    continue;

                if ("*".equals(directive))
                {
                    accept._wildcard = true;
                    continue;
                }

                EncodingProposal proposal = EncodingProposal.parse(directive);
                if (proposal != null)
                    accept._entries.add(proposal);
            }
        }
        return accept;
    }

    private final List<EncodingProposal> _entries = new ArrayList<>();
    private boolean _wildcard;

    public AcceptEncoding()
    {
    }

    public void push(EncodingProposal proposal)
    {
        _entries.add(Objects.requireNonNull(proposal, "proposal"));
    }

    public void push(ContentCoding coding)
    {
        push(new EncodingProposal(coding));
    }

    /**
     * @return true if the wildcard directive {@code *} was given
     */
    public boolean isWildcard()
    {
        return _wildcard;
    }

    public void setWildcard(boolean wildcard)
    {
        _wildcard = wildcard;
    }

    public int size()
    {
        return _entries.size();
    }

    public boolean isEmpty()
    {
        return _entries.isEmpty();
    }

    /**
     * Sort the entries by weight.
     * <p>
     * Entries with a higher weight are ordered first. Of two entries with the
     * same weight, the one declared later is ordered first.
     * </p>
     */
    public void sort()
    {
        WeightedSort.sort(_entries);
    }

    /**
     * @param available the codings the server can produce, most preferred first
     * @return the negotiated encoding
     * @throws BadMessageException with code 406 if no coding is acceptable
     * @see #negotiate(List)
     */
    public ContentEncoding negotiate(ContentCoding... available)
    {
        return negotiate(Arrays.asList(available));
    }

    /**
     * Determine the most suitable content encoding.
     * <p>
     * The entries are first {@link #sort() sorted}, then the first entry whose
     * coding is available is selected, so the client's preference decides.
     * If no entry matches and the wildcard was given, the first available
     * coding is selected, so the server's preference decides.
     * </p>
     *
     * @param available the codings the server can produce, most preferred first
     * @return the negotiated encoding
     * @throws BadMessageException with code 406 if no coding is acceptable
     */
    public ContentEncoding negotiate(List<ContentCoding> available)
    {
        sort();

        for (EncodingProposal proposal : _entries)
        {
            if (available.contains(proposal.getCoding()))
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Negotiated {} from {} for {}", proposal.getCoding(), available, this);
                return new ContentEncoding(proposal.getCoding());
            }
        }

        if (_wildcard && !available.isEmpty())
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Negotiated wildcard {} from {} for {}", available.get(0), available, this);
            return new ContentEncoding(available.get(0));
        }

        if (LOG.isDebugEnabled())
            LOG.debug("No acceptable coding in {} for {}", available, this);
        throw new BadMessageException(HttpStatus.NOT_ACCEPTABLE_406, "No suitable Content-Encoding found");
    }

    public HttpHeader getName()
    {
        return HttpHeader.ACCEPT_ENCODING;
    }

    /**
     * @return the header value of the entries in their current order, followed by any wildcard
     */
    public String getValue()
    {
        StringBuilder value = new StringBuilder();
        for (EncodingProposal proposal : _entries)
        {
            if (value.length() > 0)
                value.append(", ");
            value.append(proposal.asString());
        }
        if (_wildcard)
        {
            if (value.length() > 0)
                value.append(", ");
            value.append('*');
        }
        return value.toString();
    }

    /**
     * Set the {@code Accept-Encoding} header, replacing any existing value.
     *
     * @param fields the fields to update
     */
    public void apply(HttpFields.Mutable fields)
    {
        fields.put(getName(), getValue());
    }

    /**
     * @return a read only iterator over the entries in their current order
     */
    @Override
    public Iterator<EncodingProposal> iterator()
    {
        return Collections.unmodifiableList(_entries).iterator();
    }

    /**
     * @return an iterator over the entries in their current order, through which entries may be replaced, removed or added
     */
    public ListIterator<EncodingProposal> listIterator()
    {
        ListIterator<EncodingProposal> entries = _entries.listIterator();
        return new ListIterator<>()
        {
            @Override
            public boolean hasNext()
            {
                return entries.hasNext();
            }

            @Override
            public EncodingProposal next()
            {
                return entries.next();
            }

            @Override
            public boolean hasPrevious()
            {
                return entries.hasPrevious();
            }

            @Override
            public EncodingProposal previous()
            {
                return entries.previous();
            }

            @Override
            public int nextIndex()
            {
                return entries.nextIndex();
            }

            @Override
            public int previousIndex()
            {
                return entries.previousIndex();
            }

            @Override
            public void remove()
            {
                entries.remove();
            }

            @Override
            public void set(EncodingProposal proposal)
            {
                entries.set(Objects.requireNonNull(proposal, "proposal"));
            }

            @Override
            public void add(EncodingProposal proposal)
            {
                entries.add(Objects.requireNonNull(proposal, "proposal"));
            }
        };
    }

    public Stream<EncodingProposal> stream()
    {
        return _entries.stream();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,wildcard=%b}", getClass().getSimpleName(), hashCode(), _entries, _wildcard);
    }
}
