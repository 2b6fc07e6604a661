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

package de.qucosa.oaipmh.paging;

import java.util.ArrayList;
import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils.MillisProvider;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.cursor.DeletedRecordPolicy;
import de.qucosa.oaipmh.cursor.Watermark;
import de.qucosa.oaipmh.error.BadResumptionTokenException;
import de.qucosa.oaipmh.error.HarvestException;
import de.qucosa.oaipmh.error.NoRecordsMatchException;
import de.qucosa.oaipmh.error.StoreUnavailableException;
import de.qucosa.oaipmh.persistence.HarvestRecord;
import de.qucosa.oaipmh.persistence.PersistenceException;
import de.qucosa.oaipmh.persistence.RecordRangeQuery;
import de.qucosa.oaipmh.persistence.RecordStore;
import de.qucosa.oaipmh.sets.SetHierarchyResolver;

/**
 * Produces one page of a harvest from its {@link Cursor}.
 * <p>
 * Records are fetched in (lastModified, recordIdentifier) order strictly after the cursor's
 * watermark, never by offset, so records changed or deleted during a harvest cannot shift
 * the position of the next page. One record more than the page size is looked for to know
 * whether another page follows. Every fetched record is checked again against the cursor's
 * filters; when records are dropped the store is asked again after the last fetched row
 * until the page is full or the store has no more rows.
 */
public class PageProducer {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final RecordStore recordStore;
    private final SetHierarchyResolver setHierarchyResolver;
    private final DeletedRecordPolicy deletedRecordPolicy;
    private final MillisProvider clock;

    /**
     * @param recordStore          source of the records
     * @param setHierarchyResolver decides set membership of fetched records
     * @param deletedRecordPolicy  whether tombstones are reported
     * @param clock                source of the current time for expiry and successor issue time
     * @throws IllegalArgumentException if any parameter is {@code null}
     */
    public PageProducer(RecordStore recordStore, SetHierarchyResolver setHierarchyResolver,
                        DeletedRecordPolicy deletedRecordPolicy, MillisProvider clock) throws IllegalArgumentException {
        if (recordStore == null)
            throw new IllegalArgumentException("parameter recordStore must not be null");
        if (setHierarchyResolver == null)
            throw new IllegalArgumentException("parameter setHierarchyResolver must not be null");
        if (deletedRecordPolicy == null)
            throw new IllegalArgumentException("parameter deletedRecordPolicy must not be null");
        if (clock == null)
            throw new IllegalArgumentException("parameter clock must not be null");

        this.recordStore = recordStore;
        this.setHierarchyResolver = setHierarchyResolver;
        this.deletedRecordPolicy = deletedRecordPolicy;
        this.clock = clock;
    }

    /**
     * @param cursor position and filters of the harvest
     * @return the records of the page and the cursor of the next page, if any
     * @throws BadResumptionTokenException if the cursor is expired
     * @throws NoRecordsMatchException     if the cursor is the first of its harvest and no
     *                                     record matches
     * @throws StoreUnavailableException   if the record store fails or times out
     * @throws IllegalStateException       if the record store returns rows out of order
     */
    public ProducedPage produce(Cursor cursor) throws HarvestException, IllegalStateException {
        long now = clock.getMillis();
        if (cursor.isExpired(now)) {
            logger.debug("Cursor expired at {}", cursor.getExpirationDate());
            throw new BadResumptionTokenException();
        }

        int pageSize = cursor.getPageSize();
        // pageSize is at most Cursor.MAX_PAGE_SIZE
        int limit = pageSize + 1;
        List<HarvestRecord> page = new ArrayList<>();
        Watermark scanPosition = cursor.getWatermark();
        boolean hasMore = false;
        boolean storeExhausted = false;

        while (!hasMore && !storeExhausted) {
            RecordRangeQuery query = new RecordRangeQuery(cursor.getMetadataFormat(), cursor.getSetFilter(),
                    cursor.getLastModifiedLowerBound(), cursor.getLastModifiedUpperBound(), scanPosition,
                    deletedRecordPolicy.reportsDeletions(), limit);
            List<HarvestRecord> rows = fetch(query);
            logger.debug("{} returned {} rows", query, rows.size());

            for (HarvestRecord row : rows) {
                Watermark position = row.getWatermark();
                if (scanPosition != null && !scanPosition.isBefore(position)) {
                    logger.warn("Record store returned {} which is not after {}", position, scanPosition);
                    throw new IllegalStateException("Record store violated harvest order: " + position
                            + " is not after " + scanPosition);
                }
                scanPosition = position;

                if (!isEligible(row, cursor)) {
                    continue;
                }
                if (page.size() == pageSize) {
                    hasMore = true;
                    break;
                }
                page.add(row.isDeleted() ? row.withoutMetadata() : row);
            }
            storeExhausted = rows.size() < limit;
        }

        if (page.isEmpty()) {
            if (cursor.isFirstPage()) {
                throw new NoRecordsMatchException();
            }
            logger.debug("No records left after {}, harvest complete", cursor.getWatermark());
            return new ProducedPage(page, null);
        }

        Cursor successor = null;
        if (hasMore) {
            HarvestRecord last = page.get(page.size() - 1);
            successor = cursor.successor(last.getWatermark(), page.size(), new DateTime(now, DateTimeZone.UTC));
        }
        return new ProducedPage(page, successor);
    }

    private List<HarvestRecord> fetch(RecordRangeQuery query) throws StoreUnavailableException {
        try {
            return recordStore.findRecords(query);
        } catch (PersistenceException e) {
            logger.error("Record store failed on " + query, e);
            throw new StoreUnavailableException("The record store is temporarily unavailable", e);
        }
    }

    private boolean isEligible(HarvestRecord row, Cursor cursor) {
        DateTime lowerBound = cursor.getLastModifiedLowerBound();
        DateTime upperBound = cursor.getLastModifiedUpperBound();
        if (lowerBound != null && row.getLastModified().isBefore(lowerBound)) {
            return false;
        }
        if (upperBound != null && row.getLastModified().isAfter(upperBound)) {
            return false;
        }
        if (row.isDeleted() && !deletedRecordPolicy.reportsDeletions()) {
            return false;
        }
        String setFilter = cursor.getSetFilter();
        if (setFilter != null && !setHierarchyResolver.matches(setFilter, row.getSetSpecs())) {
            return false;
        }
        return row.canDisseminate();
    }
}
