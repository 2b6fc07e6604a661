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

import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;

import de.qucosa.oaipmh.cursor.Watermark;

/**
 * One keyset query against a {@link RecordStore}: up to {@code limit} records of a format,
 * strictly after a watermark, within an inclusive datestamp window, in ascending
 * (lastModified, recordIdentifier) order.
 */
public class RecordRangeQuery {

    private final String metadataFormat;
    @Nullable
    private final String setFilter;
    @Nullable
    private final DateTime lowerBound;
    @Nullable
    private final DateTime upperBound;
    @Nullable
    private final Watermark after;
    private final boolean includeDeleted;
    private final int limit;

    /**
     * @param metadataFormat format whose metadata is fetched alongside each record
     * @param setFilter      setSpec the records have to belong to, directly or through a
     *                       descendant set; {@code null} for all records
     * @param lowerBound     earliest datestamp, inclusive; {@code null} if unbounded
     * @param upperBound     latest datestamp, inclusive; {@code null} if unbounded
     * @param after          exclusive start position; {@code null} to start at the beginning
     * @param includeDeleted {@code false} if tombstones must not be returned
     * @param limit          maximum number of records, positive
     * @throws IllegalArgumentException if metadataFormat is {@code null} or limit is not
     *                                  positive
     */
    public RecordRangeQuery(String metadataFormat, @Nullable String setFilter, @Nullable DateTime lowerBound,
                            @Nullable DateTime upperBound, @Nullable Watermark after, boolean includeDeleted,
                            int limit) throws IllegalArgumentException {
        if (metadataFormat == null)
            throw new IllegalArgumentException("parameter metadataFormat must not be null");
        if (limit <= 0)
            throw new IllegalArgumentException("parameter limit must be positive, was " + limit);

        this.metadataFormat = metadataFormat;
        this.setFilter = setFilter;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.after = after;
        this.includeDeleted = includeDeleted;
        this.limit = limit;
    }

    public String getMetadataFormat() {
        return metadataFormat;
    }

    @Nullable
    public String getSetFilter() {
        return setFilter;
    }

    @Nullable
    public DateTime getLowerBound() {
        return lowerBound;
    }

    @Nullable
    public DateTime getUpperBound() {
        return upperBound;
    }

    @Nullable
    public Watermark getAfter() {
        return after;
    }

    public boolean isIncludeDeleted() {
        return includeDeleted;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "RecordRangeQuery [metadataFormat=" + metadataFormat + ", setFilter=" + setFilter + ", lowerBound="
                + lowerBound + ", upperBound=" + upperBound + ", after=" + after + ", includeDeleted="
                + includeDeleted + ", limit=" + limit + "]";
    }
}
