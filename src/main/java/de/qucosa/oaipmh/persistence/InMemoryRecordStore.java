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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.Watermark;
import de.qucosa.oaipmh.sets.SetHierarchyResolver;

/**
 * {@link RecordStore} held in memory, ordered by {@link Watermark}. Records not available in a
 * requested format are returned without metadata.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final SetHierarchyResolver setHierarchyResolver;
    private final ConcurrentSkipListMap<Watermark, StoredRecord> recordsInHarvestOrder = new ConcurrentSkipListMap<>();
    private final Map<String, Watermark> positionByIdentifier = new ConcurrentHashMap<>();

    public InMemoryRecordStore(SetHierarchyResolver setHierarchyResolver) {
        if (setHierarchyResolver == null)
            throw new IllegalArgumentException("parameter setHierarchyResolver must not be null");
        this.setHierarchyResolver = setHierarchyResolver;
    }

    /**
     * Add a record or replace the record with the same identifier. The record moves to the
     * position given by its new datestamp.
     *
     * @param recordIdentifier unique identifier of the record
     * @param lastModified     datestamp of this change
     * @param setSpecs         set memberships of the record
     * @param metadataByFormat serialized metadata per metadataPrefix
     */
    public synchronized void addOrUpdateRecord(String recordIdentifier, DateTime lastModified, List<String> setSpecs,
                                               Map<String, String> metadataByFormat) {
        put(new StoredRecord(recordIdentifier, lastModified, setSpecs, false, metadataByFormat));
    }

    /**
     * Replace a record with a tombstone. Unknown identifiers are added as tombstones without
     * set memberships.
     *
     * @param recordIdentifier unique identifier of the record
     * @param deletedAt        datestamp of the deletion
     */
    public synchronized void markDeleted(String recordIdentifier, DateTime deletedAt) {
        Watermark position = positionByIdentifier.get(recordIdentifier);
        List<String> setSpecs = (position == null)
                ? Collections.<String>emptyList()
                : recordsInHarvestOrder.get(position).setSpecs;
        put(new StoredRecord(recordIdentifier, deletedAt, setSpecs, true, Collections.<String, String>emptyMap()));
    }

    /**
     * Remove a record without leaving a tombstone.
     *
     * @return {@code true} if the record existed
     */
    public synchronized boolean remove(String recordIdentifier) {
        Watermark position = positionByIdentifier.remove(recordIdentifier);
        if (position == null) {
            return false;
        }
        recordsInHarvestOrder.remove(position);
        return true;
    }

    public int size() {
        return recordsInHarvestOrder.size();
    }

    @Override
    public List<HarvestRecord> findRecords(RecordRangeQuery query) throws PersistenceException {
        NavigableMap<Watermark, StoredRecord> candidates = (query.getAfter() == null)
                ? recordsInHarvestOrder
                : recordsInHarvestOrder.tailMap(query.getAfter(), false);

        List<HarvestRecord> result = new LinkedList<>();
        for (StoredRecord stored : candidates.values()) {
            if (result.size() >= query.getLimit()) {
                break;
            }
            if (query.getUpperBound() != null && stored.lastModified.isAfter(query.getUpperBound())) {
                break;
            }
            if (query.getLowerBound() != null && stored.lastModified.isBefore(query.getLowerBound())) {
                continue;
            }
            if (stored.deleted && !query.isIncludeDeleted()) {
                continue;
            }
            if (query.getSetFilter() != null && !setHierarchyResolver.matches(query.getSetFilter(), stored.setSpecs)) {
                continue;
            }
            String metadata = stored.deleted ? null : stored.metadataByFormat.get(query.getMetadataFormat());
            result.add(new HarvestRecord(stored.recordIdentifier, stored.lastModified, stored.setSpecs, stored.deleted,
                    metadata));
        }

        logger.trace("{} returned {} records", query, result.size());
        return result;
    }

    private void put(StoredRecord record) {
        Watermark newPosition = new Watermark(record.lastModified, record.recordIdentifier);
        Watermark oldPosition = positionByIdentifier.put(record.recordIdentifier, newPosition);
        recordsInHarvestOrder.put(newPosition, record);
        if (oldPosition != null && !oldPosition.equals(newPosition)) {
            recordsInHarvestOrder.remove(oldPosition);
        }
    }

    private static class StoredRecord {
        private final String recordIdentifier;
        private final DateTime lastModified;
        private final List<String> setSpecs;
        private final boolean deleted;
        private final Map<String, String> metadataByFormat;

        StoredRecord(String recordIdentifier, DateTime lastModified, List<String> setSpecs, boolean deleted,
                     Map<String, String> metadataByFormat) {
            if (StringUtils.isBlank(recordIdentifier))
                throw new IllegalArgumentException("parameter recordIdentifier must not be '" + recordIdentifier + "'");
            if (lastModified == null)
                throw new IllegalArgumentException("parameter lastModified must not be null");

            this.recordIdentifier = recordIdentifier;
            this.lastModified = lastModified;
            this.setSpecs = Collections.unmodifiableList(new ArrayList<>(setSpecs));
            this.deleted = deleted;
            this.metadataByFormat = Collections.unmodifiableMap(new HashMap<>(metadataByFormat));
        }
    }
}
