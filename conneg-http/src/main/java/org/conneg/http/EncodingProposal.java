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

import java.math.BigDecimal;
import java.util.Objects;

import org.conneg.util.StringUtil;
import org.conneg.util.Weighted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single directive of an {@code Accept-Encoding} header: a content coding
 * with an optional quality value.
 * <p>
 * A proposal without a weight is not equal to the same proposal with an
 * explicit weight of 1.0, although both are ordered the same.
 * </p>
 */
public class EncodingProposal implements Weighted
{
    private static final Logger LOG = LoggerFactory.getLogger(EncodingProposal.class);

    /**
     * Parse a single directive of the form {@code coding} or {@code coding;q=qvalue}.
     * <p>
     * A directive naming a coding that is not {@link ContentCoding#isKnown() known}
     * is ignored, whatever its parameters.
     * </p>
     *
     * @param directive the directive, without surrounding commas
     * @return the proposal, or null if the coding is not known
     * @throws IllegalArgumentException if the directive has a malformed or out of range weight
     */
    public static EncodingProposal parse(String directive)
    {
        int semi = directive.indexOf(';');
        String token = (semi < 0 ? directive : directive.substring(0, semi)).trim();

        ContentCoding coding = ContentCoding.lookup(token);
        if (coding == null)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Ignoring unknown content coding in '{}'", directive);
            return null;
        }

        if (semi < 0)
            return new EncodingProposal(coding);
        return new EncodingProposal(coding, parseWeight(directive.substring(semi + 1)));
    }

    /**
     * Parse a {@code q=qvalue} parameter.
     *
     * @param param the parameter text following the {@code ;}
     * @return the weight
     * @throws IllegalArgumentException if the parameter is not a valid weight
     */
    static float parseWeight(String param)
    {
        if (param.indexOf(';') >= 0)
            throw new IllegalArgumentException("Invalid weight, too many parameters: " + param);

        int equals = param.indexOf('=');
        if (equals < 0)
            throw new IllegalArgumentException("Invalid weight, expected q=<value>: " + param);

        String name = param.substring(0, equals).trim();
        if (!"q".equalsIgnoreCase(name))
            throw new IllegalArgumentException("Invalid weight, unknown parameter: " + name);

        String value = param.substring(equals + 1).trim();
        if (!isDecimal(value))
            throw new IllegalArgumentException("Invalid weight, not a decimal number: " + value);

        // range is checked on the exact decimal, before narrowing to a float
        if (new BigDecimal(value).compareTo(BigDecimal.ONE) > 0)
            throw new IllegalArgumentException("Invalid weight, out of range [0,1]: " + value);
        return Float.parseFloat(value);
    }

    // digits with an optional fraction, or a bare fraction
    private static boolean isDecimal(String value)
    {
        int dot = value.indexOf('.');
        if (dot < 0)
            return StringUtil.isDigits(value, 0, value.length());
        int fraction = value.length() - dot - 1;
        if (dot == 0)
            return StringUtil.isDigits(value, 1, fraction);
        return StringUtil.isDigits(value, 0, dot) && (fraction == 0 || StringUtil.isDigits(value, dot + 1, fraction));
    }

    private final ContentCoding _coding;
    private final Float _weight;

    public EncodingProposal(ContentCoding coding)
    {
        this(coding, null);
    }

    /**
     * @param coding the content coding
     * @param weight the weight in the range [0,1], or null for no weight
     * @throws IllegalArgumentException if the weight is out of range
     */
    public EncodingProposal(ContentCoding coding, Float weight)
    {
        _coding = Objects.requireNonNull(coding, "coding");
        if (weight != null && !(weight >= 0.0F && weight <= 1.0F))
            throw new IllegalArgumentException("Weight out of range [0,1]: " + weight);
        _weight = weight;
    }

    public ContentCoding getCoding()
    {
        return _coding;
    }

    @Override
    public Float getWeight()
    {
        return _weight;
    }

    public boolean is(ContentCoding coding)
    {
        return _coding.equals(coding);
    }

    /**
     * @return the directive as it appears in a header, eg {@code gzip} or {@code br;q=0.8}
     */
    public String asString()
    {
        if (_weight == null)
            return _coding.asString();
        return _coding.asString() + ";q=" + formatWeight(_weight);
    }

    // plain notation with trailing zeros removed, eg 0.8, 1 or 0.001
    private static String formatWeight(float weight)
    {
        return new BigDecimal(Float.toString(weight)).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof EncodingProposal))
            return false;
        EncodingProposal that = (EncodingProposal)o;
        return _coding.equals(that._coding) && Objects.equals(_weight, that._weight);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_coding, _weight);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,q=%s}", getClass().getSimpleName(), hashCode(), _coding, _weight);
    }
}
