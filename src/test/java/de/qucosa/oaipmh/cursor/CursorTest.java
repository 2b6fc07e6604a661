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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.junit.Test;

public class CursorTest {

    private static final DateTime ISSUED_AT = new DateTime(2024, 5, 1, 8, 0, DateTimeZone.UTC);
    private static final Duration ONE_HOUR = Duration.standardHours(1);

    private final Cursor first = Cursor.initial("oai_dc", "ddc:000", Granularity.DAY.parse("2024-01-01"),
            Granularity.DAY.parse("2024-01-31"), Granularity.DAY, 10, ISSUED_AT, ONE_HOUR);

    @Test
    public void initialCursorHasNoWatermark() {
        assertTrue(first.isFirstPage());
        assertNull(first.getWatermark());
        assertEquals(0, first.getDeliveredCount());
    }

    /**
     * The successor keeps filters, page size and lifetime and only moves position and issue time.
     */
    @Test
    public void successorKeepsFilters() {
        Watermark last = new Watermark(new DateTime(2024, 1, 5, 0, 0, DateTimeZone.UTC), "oai:x:7");
        DateTime later = ISSUED_AT.plusMinutes(5);

        Cursor next = first.successor(last, 10, later);

        assertEquals(first.getMetadataFormat(), next.getMetadataFormat());
        assertEquals(first.getSetFilter(), next.getSetFilter());
        assertEquals(first.getFromInclusive(), next.getFromInclusive());
        assertEquals(first.getUntilInclusive(), next.getUntilInclusive());
        assertEquals(first.getGranularity(), next.getGranularity());
        assertEquals(first.getPageSize(), next.getPageSize());
        assertEquals(first.getExpiresAfter(), next.getExpiresAfter());
        assertEquals(last, next.getWatermark());
        assertEquals(10, next.getDeliveredCount());
        assertEquals(later, next.getIssuedAt());
        assertFalse(next.isFirstPage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void watermarkMustAdvance() {
        Watermark last = new Watermark(new DateTime(2024, 1, 5, 0, 0, DateTimeZone.UTC), "oai:x:7");
        Cursor next = first.successor(last, 10, ISSUED_AT);

        next.successor(new Watermark(last.getLastModified(), "oai:x:6"), 10, ISSUED_AT);
    }

    @Test
    public void untilCoversWholeDay() {
        assertEquals(new DateTime(2024, 1, 31, 23, 59, 59, 999, DateTimeZone.UTC), first.getLastModifiedUpperBound());
        assertEquals(new DateTime(2024, 1, 1, 0, 0, DateTimeZone.UTC), first.getLastModifiedLowerBound());
    }

    @Test
    public void expiresAfterLifetime() {
        long deadline = ISSUED_AT.plus(ONE_HOUR).getMillis();

        assertFalse("Cursor must be valid up to its deadline", first.isExpired(deadline));
        assertTrue(first.isExpired(deadline + 1));
        assertEquals(new DateTime(deadline, DateTimeZone.UTC), first.getExpirationDate());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsFromAfterUntil() {
        Cursor.initial("oai_dc", null, Granularity.DAY.parse("2024-02-01"), Granularity.DAY.parse("2024-01-31"),
                Granularity.DAY, 10, ISSUED_AT, ONE_HOUR);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositivePageSize() {
        Cursor.initial("oai_dc", null, null, null, Granularity.DAY, 0, ISSUED_AT, ONE_HOUR);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsPageSizeAboveMaximum() {
        Cursor.initial("oai_dc", null, null, null, Granularity.DAY, Cursor.MAX_PAGE_SIZE + 1, ISSUED_AT, ONE_HOUR);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsOverlongSetFilter() {
        Cursor.initial("oai_dc", StringUtils.repeat('s', Cursor.MAX_SET_FILTER_LENGTH + 1), null, null,
                Granularity.DAY, 10, ISSUED_AT, ONE_HOUR);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsOverlongMetadataFormat() {
        Cursor.initial(StringUtils.repeat('f', Cursor.MAX_METADATA_FORMAT_LENGTH + 1), null, null, null,
                Granularity.DAY, 10, ISSUED_AT, ONE_HOUR);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDeliveredCountWithoutWatermark() {
        new Cursor("oai_dc", null, null, null, Granularity.DAY, null, 10, 20, ISSUED_AT, ONE_HOUR);
    }

    @Test
    public void equalCursorsHaveEqualHashCodes() {
        Cursor same = Cursor.initial("oai_dc", "ddc:000", Granularity.DAY.parse("2024-01-01"),
                Granularity.DAY.parse("2024-01-31"), Granularity.DAY, 10,
                ISSUED_AT.withZone(DateTimeZone.forID("America/New_York")), ONE_HOUR);

        assertEquals(first, same);
        assertEquals(first.hashCode(), same.hashCode());
    }
}
