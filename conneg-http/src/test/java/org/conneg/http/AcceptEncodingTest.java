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

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.conneg.http.ContentCoding.BR;
import static org.conneg.http.ContentCoding.DEFLATE;
import static org.conneg.http.ContentCoding.GZIP;
import static org.conneg.http.ContentCoding.IDENTITY;
import static org.conneg.http.ContentCoding.ZSTD;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AcceptEncodingTest
{
    private static List<ContentCoding> codings(AcceptEncoding accept)
    {
        return accept.stream().map(EncodingProposal::getCoding).collect(Collectors.toList());
    }

    private static AcceptEncoding roundTrip(AcceptEncoding accept)
    {
        HttpFields.Mutable fields = HttpFields.build();
        accept.apply(fields);
        return AcceptEncoding.from(fields);
    }

    @Test
    public void testSmoke()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(GZIP);

        accept = roundTrip(accept);
        assertThat(accept, notNullValue());
        assertThat(accept.iterator().next().getCoding(), is(GZIP));
        assertFalse(accept.isWildcard());
    }

    @Test
    public void testWildcard()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.setWildcard(true);
        assertThat(accept.getValue(), is("*"));

        accept = roundTrip(accept);
        assertTrue(accept.isWildcard());
        assertTrue(accept.isEmpty());
    }

    @Test
    public void testWildcardAndEntry()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(GZIP);
        accept.setWildcard(true);
        assertThat(accept.getValue(), is("gzip, *"));

        accept = roundTrip(accept);
        assertTrue(accept.isWildcard());
        assertThat(codings(accept), contains(GZIP));
    }

    @Test
    public void testIterationKeepsDeclarationOrder()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(GZIP);
        accept.push(BR);

        accept = roundTrip(accept);
        Iterator<EncodingProposal> i = accept.iterator();
        assertThat(i.next().getCoding(), is(GZIP));
        assertThat(i.next().getCoding(), is(BR));
        assertFalse(i.hasNext());
    }

    @Test
    public void testIteratorIsReadOnly()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip, br");
        Iterator<EncodingProposal> i = accept.iterator();
        i.next();
        assertThrows(UnsupportedOperationException.class, i::remove);
        assertThat(accept.size(), is(2));
    }

    @Test
    public void testListIteratorMutatesEntries()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip, br;q=0.5, deflate");
        for (ListIterator<EncodingProposal> i = accept.listIterator(); i.hasNext(); )
        {
            EncodingProposal proposal = i.next();
            if (proposal.is(BR))
                i.set(new EncodingProposal(ZSTD, 0.7F));
            else if (proposal.is(DEFLATE))
                i.remove();
        }
        assertThat(accept.getValue(), is("gzip, zstd;q=0.7"));
    }

    @Test
    public void testListIteratorRejectsNull()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip");
        ListIterator<EncodingProposal> i = accept.listIterator();
        assertThrows(NullPointerException.class, () -> i.add(null));
        i.next();
        assertThrows(NullPointerException.class, () -> i.set(null));

        assertThat(codings(accept), contains(GZIP));
        assertThat(accept.negotiate(GZIP).getCoding(), is(GZIP));
    }

    @Test
    public void testListIteratorAddAndTraverseBack()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip");
        ListIterator<EncodingProposal> i = accept.listIterator();
        i.add(new EncodingProposal(BR, 0.9F));
        assertThat(i.nextIndex(), is(1));
        assertThat(i.previous().getCoding(), is(BR));
        assertThat(accept.getValue(), is("br;q=0.9, gzip"));
    }

    @Test
    public void testSortByWeight()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(GZIP, 0.4F));
        accept.push(new EncodingProposal(IDENTITY));
        accept.push(new EncodingProposal(BR, 0.8F));

        accept = roundTrip(accept);
        accept.sort();
        assertThat(codings(accept), contains(IDENTITY, BR, GZIP));
    }

    @Test
    public void testSortByWeightAndLocation()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(IDENTITY));
        accept.push(new EncodingProposal(GZIP));
        accept.push(new EncodingProposal(BR, 0.8F));

        accept = roundTrip(accept);
        accept.sort();
        assertThat(codings(accept), contains(GZIP, IDENTITY, BR));
    }

    @Test
    public void testSortEqualExplicitWeightLaterFirst()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(GZIP, 0.5F));
        accept.push(new EncodingProposal(BR, 0.5F));
        accept.sort();
        assertThat(codings(accept), contains(BR, GZIP));
    }

    @Test
    public void testSerializeKeepsCurrentOrder()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip;q=0.4, identity, br;q=0.8");
        assertThat(accept.getValue(), is("gzip;q=0.4, identity, br;q=0.8"));
        accept.sort();
        assertThat(accept.getValue(), is("identity, br;q=0.8, gzip;q=0.4"));
    }

    @Test
    public void testNegotiate()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(BR, 0.8F));
        accept.push(new EncodingProposal(GZIP, 0.4F));
        accept.push(new EncodingProposal(IDENTITY));

        assertThat(accept.negotiate(BR, GZIP).getCoding(), is(BR));
    }

    @Test
    public void testNegotiateClientOrderWins()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip;q=0.4, identity, br;q=0.8");
        assertThat(accept.negotiate(BR, GZIP), is(new ContentEncoding(BR)));

        accept = AcceptEncoding.from("gzip;q=0.9, br;q=0.8");
        assertThat(accept.negotiate(BR, GZIP).getCoding(), is(GZIP));
    }

    @Test
    public void testNegotiateGreatestWeightMatchingFirstAvailable()
    {
        AcceptEncoding accept = AcceptEncoding.from("deflate;q=0.3, zstd;q=0.9, gzip;q=0.6");
        assertThat(accept.negotiate(ZSTD, GZIP, DEFLATE).getCoding(), is(ZSTD));
    }

    @Test
    public void testNegotiateSortsEntries()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip;q=0.1, br");
        accept.negotiate(GZIP);
        assertThat(codings(accept), contains(BR, GZIP));
    }

    @Test
    public void testNegotiateNotAcceptable()
    {
        AcceptEncoding accept = new AcceptEncoding();
        BadMessageException x = assertThrows(BadMessageException.class, () -> accept.negotiate(GZIP));
        assertThat(x.getCode(), is(HttpStatus.NOT_ACCEPTABLE_406));

        accept.push(new EncodingProposal(BR, 0.8F));
        x = assertThrows(BadMessageException.class, () -> accept.negotiate(GZIP));
        assertThat(x.getCode(), is(HttpStatus.NOT_ACCEPTABLE_406));
        assertThat(x.getReason(), containsString("Content-Encoding"));
    }

    @Test
    public void testNegotiateWildcard()
    {
        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(BR, 0.8F));
        accept.setWildcard(true);

        assertThat(accept.negotiate(GZIP).getCoding(), is(GZIP));
    }

    @Test
    public void testNegotiateWildcardPrefersServerOrder()
    {
        AcceptEncoding accept = AcceptEncoding.from("identity, *");
        assertThat(accept.negotiate(ZSTD, BR, GZIP).getCoding(), is(ZSTD));
        assertThat(accept.negotiate(GZIP, BR, IDENTITY).getCoding(), is(IDENTITY));
    }

    @Test
    public void testNegotiateWildcardNothingAvailable()
    {
        AcceptEncoding accept = AcceptEncoding.from("*");
        BadMessageException x = assertThrows(BadMessageException.class, () -> accept.negotiate(Collections.emptyList()));
        assertThat(x.getCode(), is(HttpStatus.NOT_ACCEPTABLE_406));
    }

    @Test
    public void testNegotiateMatchesZeroWeight()
    {
        AcceptEncoding accept = AcceptEncoding.from("br;q=0");
        assertThat(accept.negotiate(BR).getCoding(), is(BR));
    }

    @Test
    public void testAbsent()
    {
        HttpFields fields = HttpFields.build().add(HttpHeader.ACCEPT, "*/*");
        assertThat(AcceptEncoding.from(fields), nullValue());
    }

    @Test
    public void testPresentButEmpty()
    {
        HttpFields fields = HttpFields.build().add(HttpHeader.ACCEPT_ENCODING, "");
        AcceptEncoding accept = AcceptEncoding.from(fields);
        assertThat(accept, notNullValue());
        assertTrue(accept.isEmpty());
        assertFalse(accept.isWildcard());
    }

    @Test
    public void testOnlyUnknownCodings()
    {
        AcceptEncoding accept = AcceptEncoding.from("compress, sdch;q=0.5, x-custom;q=bogus");
        assertThat(accept, notNullValue());
        assertThat(codings(accept), is(empty()));
    }

    @Test
    public void testUnknownCodingsSkipped()
    {
        AcceptEncoding accept = AcceptEncoding.from("gzip, deflate, sdch, br");
        assertThat(codings(accept), contains(GZIP, DEFLATE, BR));
    }

    @Test
    public void testMultipleFields()
    {
        HttpFields fields = HttpFields.build()
            .add("accept-encoding", "gzip;q=0.5,")
            .add(HttpHeader.CONTENT_TYPE, "text/plain")
            .add(HttpHeader.ACCEPT_ENCODING, " , br ")
            .add("Accept-Encoding", "*, *");

        AcceptEncoding accept = AcceptEncoding.from(fields);
        assertThat(codings(accept), contains(GZIP, BR));
        assertTrue(accept.isWildcard());
        assertThat(accept.getValue(), is("gzip;q=0.5, br, *"));
    }

    @Test
    public void testWhitespaceAndCase()
    {
        AcceptEncoding accept = AcceptEncoding.from("  GZip ; Q = 0.5 ,\tBR;q=1.0  ");
        assertThat(accept.stream().collect(Collectors.toList()), contains(
            new EncodingProposal(GZIP, 0.5F),
            new EncodingProposal(BR, 1.0F)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "gzip;q=2",
        "gzip;q=1.001",
        "gzip;q=1.00000001",
        "gzip;q=-0.5",
        "gzip;q=abc",
        "gzip;q=",
        "gzip;q",
        "gzip;q=1e-1",
        "gzip;q=NaN",
        "gzip;q=0.5f",
        "gzip;level=1",
        "gzip;q=0.5;level=1",
        "br, gzip;q=Infinity"
    })
    public void testBadWeightFailsWholeValue(String value)
    {
        assertThrows(IllegalArgumentException.class, () -> AcceptEncoding.from(value));
    }

    @Test
    public void testBadWeightInLaterField()
    {
        HttpFields fields = HttpFields.build()
            .add(HttpHeader.ACCEPT_ENCODING, "gzip")
            .add(HttpHeader.ACCEPT_ENCODING, "br;q=1.5");
        assertThrows(IllegalArgumentException.class, () -> AcceptEncoding.from(fields));
    }

    @Test
    public void testRoundTrip()
    {
        for (String value : Arrays.asList(
            "gzip;q=0.4, identity, br;q=0.8",
            "zstd;q=0.001, deflate;q=0, gzip;q=1, *",
            "*",
            "",
            "br;q=.5,gzip;q=1.,identity;q=0.125"))
        {
            AcceptEncoding parsed = AcceptEncoding.from(value);
            AcceptEncoding reparsed = AcceptEncoding.from(parsed.getValue());
            assertThat(value, reparsed.stream().collect(Collectors.toList()),
                is(parsed.stream().collect(Collectors.toList())));
            assertThat(value, reparsed.isWildcard(), is(parsed.isWildcard()));
        }
    }

    @Test
    public void testApplyReplacesExisting()
    {
        HttpFields.Mutable fields = HttpFields.build()
            .add(HttpHeader.ACCEPT_ENCODING, "deflate")
            .add(HttpHeader.ACCEPT_ENCODING, "identity");

        AcceptEncoding accept = new AcceptEncoding();
        accept.push(new EncodingProposal(BR, 0.25F));
        accept.apply(fields);

        assertThat(fields.getValuesList(HttpHeader.ACCEPT_ENCODING), contains("br;q=0.25"));
        assertThat(accept.getName(), is(HttpHeader.ACCEPT_ENCODING));
    }
}
