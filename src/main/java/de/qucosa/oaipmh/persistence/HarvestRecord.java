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
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import de.qucosa.oaipmh.cursor.Watermark;

/**
 * A record as returned by a {@link RecordStore}: its header (identifier, datestamp, set
 * memberships, deletion status) and, if the record can be disseminated in the requested
 * format, the metadata in that format.
 */
public class HarvestRecord {

    private final String recordIdentifier;
    private final DateTime lastModified;
    private final List<String> setSpecs;
    private final boolean deleted;
    @Nullable
    private final String metadata;

    /**
     * @param recordIdentifier unique identifier of the record
     * @param lastModified     datestamp of the record's last change, including deletion
     * @param setSpecs         sets the record is a member of, may be empty
     * @param deleted          {@code true} if the record is a tombstone
     * @param metadata         serialized metadata in the requested format; {@code null} for
     *                         tombstones and for records not available in that format
     * @throws IllegalArgumentException if recordIdentifier is blank or longer than
     *                                  {@link Watermark#MAX_IDENTIFIER_LENGTH} characters, or
     *                                  lastModified or setSpecs is {@code null}
     */
    public HarvestRecord(String recordIdentifier, DateTime lastModified, List<String> setSpecs, boolean deleted,
                         @Nullable String metadata) throws IllegalArgumentException {
        if (StringUtils.isBlank(recordIdentifier))
            throw new IllegalArgumentException("parameter recordIdentifier must not be '" + recordIdentifier + "'");
        if (recordIdentifier.length() > Watermark.MAX_IDENTIFIER_LENGTH)
            throw new IllegalArgumentException("parameter recordIdentifier must not exceed "
                    + Watermark.MAX_IDENTIFIER_LENGTH + " characters");
        if (lastModified == null)
            throw new IllegalArgumentException("parameter lastModified must not be null");
        if (setSpecs == null)
            throw new IllegalArgumentException("parameter setSpecs must not be null");

        this.recordIdentifier = recordIdentifier;
        this.lastModified = new DateTime(lastModified.getMillis(), DateTimeZone.UTC);
        this.setSpecs = Collections.unmodifiableList(new ArrayList<>(setSpecs));
        this.deleted = deleted;
        this.metadata = metadata;
    }

    public String getRecordIdentifier() {
        return recordIdentifier;
    }

    public DateTime getLastModified() {
        return lastModified;
    }

    public List<String> getSetSpecs() {
        return setSpecs;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Nullable
    public String getMetadata() {
        return metadata;
    }

    public Watermark getWatermark() {
        return new Watermark(lastModified, recordIdentifier);
    }

    /**
     * @return {@code true} if the record can appear in a response for the format it was
     * fetched for: tombstones always can, other records only with metadata
     */
    public boolean canDisseminate() {
        return deleted || metadata != null;
    }

    /**
     * @return a copy of this record without metadata, as reported for tombstones
     */
    public HarvestRecord withoutMetadata() {
        return (metadata == null) ? this : new HarvestRecord(recordIdentifier, lastModified, setSpecs, deleted, null);
    }

    @Override
    public String toString() {
        return "HarvestRecord [recordIdentifier=" + recordIdentifier + ", lastModified=" + lastModified
                + ", setSpecs=" + setSpecs + ", deleted=" + deleted + ", hasMetadata=" + (metadata != null) + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + recordIdentifier.hashCode();
        result = prime * result + lastModified.hashCode();
        result = prime * result + setSpecs.hashCode();
        result = prime * result + (deleted ? 1231 : 1237);
        result = prime * result + ((metadata == null) ? 0 : metadata.hashCode());
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
        HarvestRecord other = (HarvestRecord) obj;
        if (!recordIdentifier.equals(other.recordIdentifier))
            return false;
        if (!lastModified.equals(other.lastModified))
            return false;
        if (!setSpecs.equals(other.setSpecs))
            return false;
        if (deleted != other.deleted)
            return false;
        if (metadata == null) {
            if (other.metadata != null)
                return false;
        } else if (!metadata.equals(other.metadata))
            return false;
        return true;
    }
}
