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

package de.qucosa.oaipmh.persistence;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Before;
import org.junit.Test;

import de.qucosa.oaipmh.cursor.Watermark;
import de.qucosa.oaipmh.sets.HierarchicalSetResolver;

public class InMemoryRecordStoreTest {

    private static final DateTime T0 = new DateTime(2024, 1, 1, 0, 0, DateTimeZone.UTC);
    private static final Map<String, String> DC = Collections.singletonMap("oai_dc", "<dc/>");

    private InMemoryRecordStore store;

    @Test
    public void returnsRecordsInHarvestOrder() throws Exception {
        assertEquals(Arrays.asList("oai:x:b", "oai:x:c", "oai:x:a", "oai:x:d"), identifiers(query(null, 10)));
    }

    @Test
    public void continuesStrictlyAfterWatermark() throws Exception {
        assertEquals(Arrays.asList("oai:x:a", "oai:x:d"), identifiers(query(new Watermark(T0, "oai:x:c"), 10)));
    }

    @Test
    public void respectsLimit() throws Exception {
        assertEquals(Arrays.asList("oai:x:b", "oai:x:c"), identifiers(query(null, 2)));
    }

    /**
     * An updated record moves to the end of the harvest order.
     */
    @Test
    public void updateMovesRecord() throws Exception {
        store.addOrUpdateRecord("oai:x:b", T0.plusDays(5), Collections.<String>emptyList(), DC);

        assertEquals(Arrays.asList("oai:x:c", "oai:x:a", "oai:x:d", "oai:x:b"), identifiers(query(null, 10)));
        assertEquals(4, store.size());
    }

    @Test
    public void deletionLeavesTombstoneWithoutMetadata() throws Exception {
        store.markDeleted("oai:x:c", T0.plusDays(6));

        List<HarvestRecord> records = query(new Watermark(T0.plusDays(5), "oai:x:z"), 10);
        assertEquals(1, records.size());
        assertTrue(records.get(0).isDeleted());
        assertNull(records.get(0).getMetadata());
        assertEquals(Collections.singletonList("ddc:000"), records.get(0).getSetSpecs());

        List<HarvestRecord> withoutDeleted = store.findRecords(
                new RecordRangeQuery("oai_dc", null, null, null, null, false, 10));
        assertEquals(Arrays.asList("oai:x:b", "oai:x:a", "oai:x:d"), identifiers(withoutDeleted));
    }

    @Test
    public void recordWithoutFormatHasNoMetadata() throws Exception {
        List<HarvestRecord> records = store.findRecords(
                new RecordRangeQuery("xMetaDissPlus", null, null, null, null, true, 10));

        assertEquals(4, records.size());
        for (HarvestRecord record : records) {
            assertFalse("Record " + record + " must not be disseminable", record.canDisseminate());
        }
    }

    @Test
    public void appliesSetFilterAndBounds() throws Exception {
        List<HarvestRecord> inSet = store.findRecords(
                new RecordRangeQuery("oai_dc", "ddc", null, null, null, true, 10));
        assertEquals(Arrays.asList("oai:x:c", "oai:x:a"), identifiers(inSet));

        List<HarvestRecord> inWindow = store.findRecords(
                new RecordRangeQuery("oai_dc", null, T0.plusDays(1), T0.plusDays(1), null, true, 10));
        assertEquals(Collections.singletonList("oai:x:a"), identifiers(inWindow));
    }

    @Test
    public void removeLeavesNoTrace() throws Exception {
        assertTrue(store.remove("oai:x:a"));
        assertFalse(store.remove("oai:x:a"));
        assertEquals(Arrays.asList("oai:x:b", "oai:x:c", "oai:x:d"), identifiers(query(null, 10)));
    }

    private List<HarvestRecord> query(Watermark after, int limit) throws PersistenceException {
        return store.findRecords(new RecordRangeQuery("oai_dc", null, null, null, after, true, limit));
    }

    private static List<String> identifiers(List<HarvestRecord> records) {
        List<String> identifiers = new ArrayList<>();
        for (HarvestRecord record : records) {
            identifiers.add(record.getRecordIdentifier());
        }
        return identifiers;
    }

    @Before
    public void setUp() {
        store = new InMemoryRecordStore(new HierarchicalSetResolver());
        store.addOrUpdateRecord("oai:x:a", T0.plusDays(1), Arrays.asList("ddc:100"), DC);
        store.addOrUpdateRecord("oai:x:b", T0, Collections.<String>emptyList(), DC);
        store.addOrUpdateRecord("oai:x:c", T0, Arrays.asList("ddc:000"), DC);
        store.addOrUpdateRecord("oai:x:d", T0.plusDays(2), Arrays.asList("open_access"), DC);
    }
}
