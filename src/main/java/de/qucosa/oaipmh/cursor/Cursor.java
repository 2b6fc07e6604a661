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

import org.apache.commons.lang3.StringUtils;
import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.Duration;

/**
 * The complete state of a selective harvest: the filters of the original request, the page
 * size, the position of the last delivered record and the time the cursor was issued.
 * <p>
 * A Cursor is immutable. The next page's cursor is derived with
 * {@link #successor(Watermark, int, DateTime)}; its watermark must be strictly greater than
 * this cursor's. The server never stores cursors, they only travel inside resumption tokens.
 */
public final class Cursor {

    public static final int MAX_PAGE_SIZE = 10000;
    public static final int MAX_METADATA_FORMAT_LENGTH = 64;
    public static final int MAX_SET_FILTER_LENGTH = 255;

    private final String metadataFormat;
    @Nullable
    private final String setFilter;
    @Nullable
    private final DateTime fromInclusive;
    @Nullable
    private final DateTime untilInclusive;
    private final Granularity granularity;
    @Nullable
    private final Watermark watermark;
    private final int pageSize;
    private final long deliveredCount;
    private final DateTime issuedAt;
    private final Duration expiresAfter;

    /**
     * @param metadataFormat  metadataPrefix of the requested format
     * @param setFilter       setSpec to harvest, {@code null} for no set restriction
     * @param fromInclusive   start of the from period in UTC, {@code null} if not restricted
     * @param untilInclusive  start of the until period in UTC, {@code null} if not restricted.
     *                        The whole period (day or second) is included, see
     *                        {@link #getLastModifiedUpperBound()}.
     * @param granularity     granularity of from and until, fixed for the harvest
     * @param watermark       the last delivered record, {@code null} on the first page
     * @param pageSize        records per page, fixed for the harvest
     * @param deliveredCount  number of records delivered before the page this cursor selects
     * @param issuedAt        time this cursor was created
     * @param expiresAfter    lifetime of this cursor, counted from issuedAt
     * @throws IllegalArgumentException if a required parameter is missing, metadataFormat or
     *                                  setFilter is too long, from is after until, pageSize
     *                                  is not between 1 and {@value #MAX_PAGE_SIZE},
     *                                  expiresAfter is not positive, or deliveredCount does
     *                                  not fit the watermark
     */
    public Cursor(String metadataFormat, @Nullable String setFilter, @Nullable DateTime fromInclusive,
                  @Nullable DateTime untilInclusive, Granularity granularity, @Nullable Watermark watermark,
                  int pageSize, long deliveredCount, DateTime issuedAt, Duration expiresAfter)
            throws IllegalArgumentException {

        if (StringUtils.isBlank(metadataFormat))
            throw new IllegalArgumentException("parameter metadataFormat must not be '" + metadataFormat + "'");
        if (metadataFormat.length() > MAX_METADATA_FORMAT_LENGTH)
            throw new IllegalArgumentException("parameter metadataFormat must not exceed " + MAX_METADATA_FORMAT_LENGTH
                    + " characters");
        if (setFilter != null && StringUtils.isBlank(setFilter))
            throw new IllegalArgumentException("parameter setFilter must be null or a setSpec, not '" + setFilter + "'");
        if (setFilter != null && setFilter.length() > MAX_SET_FILTER_LENGTH)
            throw new IllegalArgumentException("parameter setFilter must not exceed " + MAX_SET_FILTER_LENGTH
                    + " characters");
        if (granularity == null)
            throw new IllegalArgumentException("parameter granularity must not be null");
        if (fromInclusive != null && untilInclusive != null && fromInclusive.isAfter(untilInclusive))
            throw new IllegalArgumentException("from " + fromInclusive + " must not be after until " + untilInclusive);
        if (pageSize <= 0 || pageSize > MAX_PAGE_SIZE)
            throw new IllegalArgumentException("parameter pageSize must be between 1 and " + MAX_PAGE_SIZE + ", was "
                    + pageSize);
        if (deliveredCount < 0)
            throw new IllegalArgumentException("parameter deliveredCount must not be negative, was " + deliveredCount);
        if ((watermark == null) != (deliveredCount == 0))
            throw new IllegalArgumentException("a watermark requires delivered records and vice versa (watermark="
                    + watermark + ", deliveredCount=" + deliveredCount + ")");
        if (issuedAt == null)
            throw new IllegalArgumentException("parameter issuedAt must not be null");
        if (expiresAfter == null || expiresAfter.getMillis() <= 0)
            throw new IllegalArgumentException("parameter expiresAfter must be a positive duration, was " + expiresAfter);

        this.metadataFormat = metadataFormat;
        this.setFilter = setFilter;
        this.fromInclusive = toUtc(fromInclusive);
        this.untilInclusive = toUtc(untilInclusive);
        this.granularity = granularity;
        this.watermark = watermark;
        this.pageSize = pageSize;
        this.deliveredCount = deliveredCount;
        this.issuedAt = toUtc(issuedAt);
        this.expiresAfter = expiresAfter;
    }

    /**
     * Create the cursor of a harvest's first page.
     */
    public static Cursor initial(String metadataFormat, @Nullable String setFilter, @Nullable DateTime fromInclusive,
                                 @Nullable DateTime untilInclusive, Granularity granularity, int pageSize,
                                 DateTime issuedAt, Duration expiresAfter) throws IllegalArgumentException {
        return new Cursor(metadataFormat, setFilter, fromInclusive, untilInclusive, granularity, null, pageSize, 0,
                issuedAt, expiresAfter);
    }

    /**
     * Derive the cursor of the next page. All filters, the page size and the lifetime are kept.
     *
     * @param lastDelivered position of the last record of the page just produced
     * @param delivered     number of records on the page just produced
     * @param now           issue time of the new cursor
     * @return a new cursor, this cursor is not modified
     * @throws IllegalArgumentException if lastDelivered is not strictly after this cursor's
     *                                  watermark or delivered is not positive
     */
    public Cursor successor(Watermark lastDelivered, int delivered, DateTime now) throws IllegalArgumentException {
        if (lastDelivered == null)
            throw new IllegalArgumentException("parameter lastDelivered must not be null");
        if (watermark != null && !watermark.isBefore(lastDelivered))
            throw new IllegalArgumentException("watermark must advance: " + lastDelivered + " is not after " + watermark);
        if (delivered <= 0)
            throw new IllegalArgumentException("parameter delivered must be positive, was " + delivered);

        return new Cursor(metadataFormat, setFilter, fromInclusive, untilInclusive, granularity, lastDelivered,
                pageSize, deliveredCount + delivered, now, expiresAfter);
    }

    public String getMetadataFormat() {
        return metadataFormat;
    }

    @Nullable
    public String getSetFilter() {
        return setFilter;
    }

    @Nullable
    public DateTime getFromInclusive() {
        return fromInclusive;
    }

    @Nullable
    public DateTime getUntilInclusive() {
        return untilInclusive;
    }

    /**
     * @return the earliest datestamp a record may have, or {@code null} if unbounded
     */
    @Nullable
    public DateTime getLastModifiedLowerBound() {
        return fromInclusive;
    }

    /**
     * @return the latest datestamp a record may have, i.e. the last millisecond of the until
     * day or second; {@code null} if unbounded
     */
    @Nullable
    public DateTime getLastModifiedUpperBound() {
        return (untilInclusive == null) ? null : granularity.endOfPeriod(untilInclusive);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    @Nullable
    public Watermark getWatermark() {
        return watermark;
    }

    public boolean isFirstPage() {
        return watermark == null;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getDeliveredCount() {
        return deliveredCount;
    }

    public DateTime getIssuedAt() {
        return issuedAt;
    }

    public Duration getExpiresAfter() {
        return expiresAfter;
    }

    public DateTime getExpirationDate() {
        return issuedAt.plus(expiresAfter);
    }

    /**
     * @param nowMillis current time in milliseconds since the epoch
     * @return {@code true} if now is past issuedAt + expiresAfter
     */
    public boolean isExpired(long nowMillis) {
        return nowMillis > issuedAt.getMillis() + expiresAfter.getMillis();
    }

    @Nullable
    private static DateTime toUtc(@Nullable DateTime dateTime) {
        return (dateTime == null) ? null : new DateTime(dateTime.getMillis(), DateTimeZone.UTC);
    }

    @Override
    public String toString() {
        return "Cursor [metadataFormat=" + metadataFormat + ", setFilter=" + setFilter + ", from=" + fromInclusive
                + ", until=" + untilInclusive + ", granularity=" + granularity + ", watermark=" + watermark
                + ", pageSize=" + pageSize + ", deliveredCount=" + deliveredCount + ", issuedAt=" + issuedAt
                + ", expiresAfter=" + expiresAfter + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + metadataFormat.hashCode();
        result = prime * result + ((setFilter == null) ? 0 : setFilter.hashCode());
        result = prime * result + ((fromInclusive == null) ? 0 : fromInclusive.hashCode());
        result = prime * result + ((untilInclusive == null) ? 0 : untilInclusive.hashCode());
        result = prime * result + granularity.hashCode();
        result = prime * result + ((watermark == null) ? 0 : watermark.hashCode());
        result = prime * result + pageSize;
        result = prime * result + (int) (deliveredCount ^ (deliveredCount >>> 32));
        result = prime * result + issuedAt.hashCode();
        result = prime * result + expiresAfter.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Cursor other = (Cursor) obj;
        if (!metadataFormat.equals(other.metadataFormat))
            return false;
        if (setFilter == null) {
            if (other.setFilter != null)
                return false;
        } else if (!setFilter.equals(other.setFilter))
            return false;
        if (fromInclusive == null) {
            if (other.fromInclusive != null)
                return false;
        } else if (!fromInclusive.equals(other.fromInclusive))
            return false;
        if (untilInclusive == null) {
            if (other.untilInclusive != null)
                return false;
        } else if (!untilInclusive.equals(other.untilInclusive))
            return false;
        if (granularity != other.granularity)
            return false;
        if (watermark == null) {
            if (other.watermark != null)
                return false;
        } else if (!watermark.equals(other.watermark))
            return false;
        if (pageSize != other.pageSize || deliveredCount != other.deliveredCount)
            return false;
        if (!issuedAt.equals(other.issuedAt))
            return false;
        return expiresAfter.equals(other.expiresAfter);
    }
}
