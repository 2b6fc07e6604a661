/*
 * Copyright 2017 Saxon State and University Library Dresden (SLUB)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package de.qucosa.oaipmh.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import de.qucosa.oaipmh.error.BadArgumentException;
import de.qucosa.oaipmh.token.ResumptionTokenCodec;

public class HarvestRequestTest {

    @Test
    public void parsesSelectiveHarvestingArguments() throws Exception {
        HarvestRequest request = HarvestRequest.fromQueryString(
                "verb=ListRecords&metadataPrefix=oai_dc&set=ddc%3A000&from=2024-01-01&until=2024-01-31");

        assertEquals("ListRecords", request.getVerb());
        assertEquals("oai_dc", request.getMetadataPrefix());
        assertEquals("ddc:000", request.getSet());
        assertEquals("2024-01-01", request.getFrom());
        assertEquals("2024-01-31", request.getUntil());
        assertNull(request.getResumptionToken());
        assertTrue(request.hasSelectiveHarvestingArguments());
    }

    @Test
    public void tokenAloneIsNoSelectiveHarvestingArgument() throws Exception {
        HarvestRequest request = HarvestRequest.fromQueryString("verb=ListIdentifiers&resumptionToken=abc.def");

        assertTrue(request.hasResumptionToken());
        assertFalse(request.hasSelectiveHarvestingArguments());
    }

    @Test(expected = BadArgumentException.class)
    public void rejectsRepeatedArgument() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&metadataPrefix=oai_dc&metadataPrefix=mets");
    }

    @Test(expected = BadArgumentException.class)
    public void rejectsUnknownArgument() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&metadataPrefix=oai_dc&pageSize=1000");
    }

    @Test(expected = BadArgumentException.class)
    public void rejectsArgumentWithoutValue() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&metadataPrefix");
    }

    @Test(expected = BadArgumentException.class)
    public void rejectsOverlongQuery() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&set=" + StringUtils.repeat('a', HarvestRequest.MAX_QUERY_LENGTH));
    }

    /**
     * The query length limit does not count the resumption token, which has a limit of its own.
     */
    @Test
    public void acceptsResumptionTokenOfMaximumLength() throws Exception {
        String token = StringUtils.repeat('A', ResumptionTokenCodec.MAX_TOKEN_LENGTH);

        HarvestRequest request = HarvestRequest.fromQueryString("verb=ListRecords&resumptionToken=" + token);

        assertEquals(token, request.getResumptionToken());
    }

    @Test(expected = BadArgumentException.class)
    public void resumptionTokenDoesNotExtendLimitOfOtherArguments() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&resumptionToken=abc.def&set="
                + StringUtils.repeat('a', HarvestRequest.MAX_QUERY_LENGTH));
    }

    @Test(expected = BadArgumentException.class)
    public void rejectsOverlongResumptionToken() throws Exception {
        HarvestRequest.fromQueryString("verb=ListRecords&resumptionToken="
                + StringUtils.repeat('A', HarvestRequest.MAX_QUERY_LENGTH + ResumptionTokenCodec.MAX_TOKEN_LENGTH));
    }

    @Test
    public void emptyQueryHasNoArguments() throws Exception {
        HarvestRequest request = HarvestRequest.fromQueryString("");

        assertNull(request.getVerb());
        assertFalse(request.hasResumptionToken());
        assertFalse(request.hasSelectiveHarvestingArguments());
    }
}
