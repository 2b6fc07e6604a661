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

package de.qucosa.oaipmh.cursor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

public class WatermarkTest {

    private static final DateTime T1 = new DateTime(2024, 3, 1, 12, 0, DateTimeZone.UTC);
    private static final DateTime T2 = T1.plusMillis(1);

    @Test
    public void ordersByTimeBeforeIdentifier() {
        assertTrue(new Watermark(T1, "z").isBefore(new Watermark(T2, "a")));
        assertFalse(new Watermark(T2, "a").isBefore(new Watermark(T1, "z")));
    }

    /**
     * Records sharing a datestamp are ordered by identifier.
     */
    @Test
    public void breaksTiesByIdentifier() {
        assertTrue(new Watermark(T1, "oai:x:10").isBefore(new Watermark(T1, "oai:x:9")));
        assertTrue(new Watermark(T1, "oai:x:B").isBefore(new Watermark(T1, "oai:x:a")));
        assertEquals(0, new Watermark(T1, "oai:x:1").compareTo(new Watermark(T1, "oai:x:1")));
    }

    @Test
    public void equalityIgnoresTimeZone() {
        DateTime berlin = T1.withZone(DateTimeZone.forID("Europe/Berlin"));
        Watermark expected = new Watermark(T1, "oai:x:1");
        Watermark actual = new Watermark(berlin, "oai:x:1");

        assertEquals(expected, actual);
        assertEquals(expected.hashCode(), actual.hashCode());
        assertEquals(DateTimeZone.UTC, actual.getLastModified().getZone());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBlankIdentifier() {
        new Watermark(T1, " ");
    }

    @Test
    public void acceptsIdentifierOfMaximumLength() {
        String identifier = StringUtils.repeat('i', Watermark.MAX_IDENTIFIER_LENGTH);

        assertEquals(identifier, new Watermark(T1, identifier).getRecordIdentifier());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsOverlongIdentifier() {
        new Watermark(T1, StringUtils.repeat('i', Watermark.MAX_IDENTIFIER_LENGTH + 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMissingDatestamp() {
        new Watermark(null, "oai:x:1");
    }
}
