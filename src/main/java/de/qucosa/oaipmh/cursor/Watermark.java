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
import org.eclipse.jdt.annotation.NonNull;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

/**
 * Position in the total harvest order: the (lastModified, recordIdentifier) pair of the last
 * record already delivered. Records sharing a datestamp are ordered by identifier, compared
 * with {@link String#compareTo(String)}.
 */
public final class Watermark implements Comparable<Watermark> {

    public static final int MAX_IDENTIFIER_LENGTH = 255;

    private final long lastModifiedMillis;
    @NonNull
    private final String recordIdentifier;

    /**
     * @param lastModified     datestamp of the record
     * @param recordIdentifier unique identifier of the record
     * @throws IllegalArgumentException if lastModified is {@code null} or recordIdentifier is
     *                                  whitespace, empty ("") or {@code null} or longer than
     *                                  {@value #MAX_IDENTIFIER_LENGTH} characters
     */
    public Watermark(DateTime lastModified, String recordIdentifier) throws IllegalArgumentException {
        if (lastModified == null)
            throw new IllegalArgumentException("parameter lastModified must not be null");
        if (StringUtils.isBlank(recordIdentifier))
            throw new IllegalArgumentException("parameter recordIdentifier must not be '" + recordIdentifier + "'");
        if (recordIdentifier.length() > MAX_IDENTIFIER_LENGTH)
            throw new IllegalArgumentException("parameter recordIdentifier must not exceed " + MAX_IDENTIFIER_LENGTH
                    + " characters");

        this.lastModifiedMillis = lastModified.getMillis();
        this.recordIdentifier = recordIdentifier;
    }

    @NonNull
    public DateTime getLastModified() {
        return new DateTime(lastModifiedMillis, DateTimeZone.UTC);
    }

    public long getLastModifiedMillis() {
        return lastModifiedMillis;
    }

    @NonNull
    public String getRecordIdentifier() {
        return recordIdentifier;
    }

    public boolean isBefore(Watermark other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Watermark other) {
        int byTime = Long.compare(lastModifiedMillis, other.lastModifiedMillis);
        if (byTime != 0) {
            return byTime;
        }
        return recordIdentifier.compareTo(other.recordIdentifier);
    }

    @Override
    public String toString() {
        return "Watermark [lastModified=" + getLastModified() + ", recordIdentifier=" + recordIdentifier + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + (int) (lastModifiedMillis ^ (lastModifiedMillis >>> 32));
        result = prime * result + recordIdentifier.hashCode();
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
        Watermark other = (Watermark) obj;
        return lastModifiedMillis == other.lastModifiedMillis && recordIdentifier.equals(other.recordIdentifier);
    }
}
