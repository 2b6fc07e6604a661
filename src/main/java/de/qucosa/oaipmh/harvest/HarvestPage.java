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

package de.qucosa.oaipmh.harvest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;

import de.qucosa.oaipmh.persistence.HarvestRecord;

/**
 * One page of a ListRecords or ListIdentifiers response, ready to be serialized.
 */
public class HarvestPage {

    private final List<HarvestRecord> records;
    @Nullable
    private final String resumptionToken;
    @Nullable
    private final DateTime expirationDate;
    private final long cursorPosition;
    private final boolean lastPageOfSequence;

    /**
     * @param records            records of this page in harvest order
     * @param resumptionToken    token for the next page, {@code null} if the harvest is complete
     * @param expirationDate     expiry of resumptionToken, {@code null} without token
     * @param cursorPosition     number of records delivered before this page
     * @param lastPageOfSequence {@code true} if this page completes a harvest that spans
     *                           several pages
     */
    public HarvestPage(List<HarvestRecord> records, @Nullable String resumptionToken,
                       @Nullable DateTime expirationDate, long cursorPosition, boolean lastPageOfSequence) {
        if (records == null)
            throw new IllegalArgumentException("parameter records must not be null");
        if ((resumptionToken == null) != (expirationDate == null))
            throw new IllegalArgumentException("a resumptionToken requires an expirationDate and vice versa");
        if (resumptionToken != null && lastPageOfSequence)
            throw new IllegalArgumentException("the last page of a sequence must not carry a resumptionToken");

        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.resumptionToken = resumptionToken;
        this.expirationDate = expirationDate;
        this.cursorPosition = cursorPosition;
        this.lastPageOfSequence = lastPageOfSequence;
    }

    public List<HarvestRecord> getRecords() {
        return records;
    }

    @Nullable
    public String getResumptionToken() {
        return resumptionToken;
    }

    public boolean hasResumptionToken() {
        return resumptionToken != null;
    }

    @Nullable
    public DateTime getExpirationDate() {
        return expirationDate;
    }

    /**
     * @return value of the resumptionToken element's {@code cursor} attribute
     */
    public long getCursorPosition() {
        return cursorPosition;
    }

    public boolean isComplete() {
        return resumptionToken == null;
    }

    /**
     * @return {@code true} if the response must contain an empty resumptionToken element
     */
    public boolean isLastPageOfSequence() {
        return lastPageOfSequence;
    }

    @Override
    public String toString() {
        return "HarvestPage [records=" + records.size() + ", hasResumptionToken=" + hasResumptionToken()
                + ", expirationDate=" + expirationDate + ", cursorPosition=" + cursorPosition
                + ", lastPageOfSequence=" + lastPageOfSequence + "]";
    }
}
