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

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

public class GranularityTest {

    @Test
    public void detectsGranularityByShape() {
        assertEquals(Granularity.DAY, Granularity.detect("2024-01-31"));
        assertEquals(Granularity.SECOND, Granularity.detect("2024-01-31T23:59:59Z"));
        assertNull(Granularity.detect("2024-01-31T23:59Z"));
        assertNull(Granularity.detect("2024-01-31T23:59:59"));
        assertNull(Granularity.detect("31.01.2024"));
        assertNull(Granularity.detect(null));
    }

    @Test
    public void parsesAsUtc() {
        assertEquals(new DateTime(2024, 1, 31, 0, 0, DateTimeZone.UTC), Granularity.DAY.parse("2024-01-31"));
        assertEquals(new DateTime(2024, 1, 31, 23, 59, 59, DateTimeZone.UTC),
                Granularity.SECOND.parse("2024-01-31T23:59:59Z"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsImpossibleDate() {
        Granularity.DAY.parse("2023-02-30");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDatestampOfOtherGranularity() {
        Granularity.DAY.parse("2024-01-31T00:00:00Z");
    }

    /**
     * An until datestamp includes the whole day or second it denotes.
     */
    @Test
    public void endOfPeriodIsLastMillisecond() {
        assertEquals(new DateTime(2024, 1, 31, 23, 59, 59, 999, DateTimeZone.UTC),
                Granularity.DAY.endOfPeriod(Granularity.DAY.parse("2024-01-31")));
        assertEquals(new DateTime(2024, 1, 31, 12, 0, 0, 999, DateTimeZone.UTC),
                Granularity.SECOND.endOfPeriod(Granularity.SECOND.parse("2024-01-31T12:00:00Z")));
    }

    @Test
    public void formatsAndResolvesLabels() {
        assertEquals("2024-01-31T08:05:09Z",
                Granularity.SECOND.format(new DateTime(2024, 1, 31, 8, 5, 9, 500, DateTimeZone.UTC)));
        assertEquals(Granularity.DAY, Granularity.fromLabel("YYYY-MM-DD"));
        assertEquals(Granularity.SECOND, Granularity.fromLabel("YYYY-MM-DDThh:mm:ssZ"));
        assertTrue(Granularity.SECOND.isFinerThan(Granularity.DAY));
        assertFalse(Granularity.DAY.isFinerThan(Granularity.DAY));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownLabel() {
        Granularity.fromLabel("YYYY-MM-DDThh:mmZ");
    }
}
