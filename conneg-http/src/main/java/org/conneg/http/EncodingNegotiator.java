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
import java.util.List;
import java.util.stream.Collectors;

import org.conneg.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the {@code Content-Encoding} of a response from the codings a
 * server can produce and the {@code Accept-Encoding} of the request.
 * <p>
 * The available codings are held in server preference order. They may be
 * configured with the setters, or by default from the
 * {@value #AVAILABLE_PROPERTY} System property, a comma separated list of
 * codings that defaults to {@value #DEFAULT_AVAILABLE}.
 * </p>
 * <p>
 * An instance should be configured before it is used. Once configured it may
 * be shared by requests handled on different threads.
 * </p>
 */
public class EncodingNegotiator
{
    private static final Logger LOG = LoggerFactory.getLogger(EncodingNegotiator.class);

    public static final String AVAILABLE_PROPERTY = "org.conneg.http.EncodingNegotiator.AVAILABLE";
    public static final String DEFAULT_AVAILABLE = "br, gzip";

    private volatile List<ContentCoding> _available = Collections.emptyList();
    private boolean _vary = true;

    public EncodingNegotiator()
    {
        String available = System.getProperty(AVAILABLE_PROPERTY, DEFAULT_AVAILABLE);
        List<ContentCoding> codings = new ArrayList<>();
        for (String token : StringUtil.csvSplit(available))
        {
            try
            {
                codings.add(ContentCoding.from(token));
            }
            catch (IllegalArgumentException e)
            {
                LOG.warn("Ignoring invalid content coding '{}' in {}", token, AVAILABLE_PROPERTY, e);
            }
        }
        setAvailable(codings);
    }

    public EncodingNegotiator(ContentCoding... available)
    {
        setAvailable(available);
    }

    /**
     * @return the codings the server can produce, most preferred first
     */
    public List<ContentCoding> getAvailable()
    {
        return _available;
    }

    public void setAvailable(ContentCoding... available)
    {
        setAvailable(Arrays.asList(available));
    }

    /**
     * Set the available codings from a comma separated list.
     * <p>
     * Unlike the {@value #AVAILABLE_PROPERTY} System property, from which invalid
     * tokens are skipped with a warning, this setter is strict: an invalid token
     * fails the whole list and the current codings are kept.
     * </p>
     *
     * @param available a comma separated list of codings, most preferred first
     * @throws IllegalArgumentException if a coding is not a valid token
     */
    public void setAvailable(String available)
    {
        setAvailable(StringUtil.csvSplit(available).stream()
            .map(ContentCoding::from)
            .collect(Collectors.toList()));
    }

    public void setAvailable(List<ContentCoding> available)
    {
        List<ContentCoding> codings = new ArrayList<>(available.size());
        for (ContentCoding coding : available)
        {
            if (coding == null)
                throw new IllegalArgumentException("null coding");
            if (!codings.contains(coding))
                codings.add(coding);
        }
        _available = Collections.unmodifiableList(codings);
        if (LOG.isDebugEnabled())
            LOG.debug("Available codings {} for {}", _available, this);
    }

    /**
     * @return true if {@code Vary: Accept-Encoding} is added to responses
     */
    public boolean isVary()
    {
        return _vary;
    }

    public void setVary(boolean vary)
    {
        _vary = vary;
    }

    /**
     * Negotiate the encoding of a response.
     * <p>
     * If the request has no {@code Accept-Encoding} header, null is returned and
     * the response should not be encoded.  Otherwise the negotiated encoding is
     * returned and, unless it is {@code identity}, set as the
     * {@code Content-Encoding} of the response.
     * </p>
     *
     * @param request the request fields
     * @param response the response fields to update
     * @return the negotiated encoding, or null if the request does not constrain the encoding
     * @throws BadMessageException with code 400 if the {@code Accept-Encoding} header is malformed,
     * or with code 406 if no available coding is acceptable
     */
    public ContentEncoding negotiate(HttpFields request, HttpFields.Mutable response)
    {
        if (_vary)
            addVary(response);

        AcceptEncoding accept;
        try
        {
            accept = AcceptEncoding.from(request);
        }
        catch (IllegalArgumentException e)
        {
            throw new BadMessageException(HttpStatus.BAD_REQUEST_400, "Bad " + HttpHeader.ACCEPT_ENCODING, e);
        }

        if (accept == null)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("No {} in request", HttpHeader.ACCEPT_ENCODING);
            return null;
        }

        ContentEncoding encoding = accept.negotiate(_available);
        if (!encoding.is(ContentCoding.IDENTITY))
            encoding.apply(response);
        return encoding;
    }

    private void addVary(HttpFields.Mutable response)
    {
        if (response.contains(HttpHeader.VARY, "*") || response.contains(HttpHeader.VARY, HttpHeader.ACCEPT_ENCODING.asString()))
            return;
        response.add(HttpHeader.VARY, HttpHeader.ACCEPT_ENCODING.asString());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{available=%s,vary=%b}", getClass().getSimpleName(), hashCode(), _available, _vary);
    }
}
