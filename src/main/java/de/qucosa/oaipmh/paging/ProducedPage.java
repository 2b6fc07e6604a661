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
import java.util.Collections;
import java.util.List;

import org.eclipse.jdt.annotation.Nullable;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.persistence.HarvestRecord;

/**
 * Result of {@link PageProducer#produce(Cursor)}: the records of one page in harvest order and
 * the cursor of the following page, if there is one.
 */
public class ProducedPage {

    private final List<HarvestRecord> records;
    @Nullable
    private final Cursor successor;

    public ProducedPage(List<HarvestRecord> records, @Nullable Cursor successor) {
        if (records == null)
            throw new IllegalArgumentException("parameter records must not be null");
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.successor = successor;
    }

    public List<HarvestRecord> getRecords() {
        return records;
    }

    /**
     * @return the cursor of the next page, {@code null} if this page completes the harvest
     */
    @Nullable
    public Cursor getSuccessor() {
        return successor;
    }

    public boolean isComplete() {
        return successor == null;
    }

    @Override
    public String toString() {
        return "ProducedPage [records=" + records.size() + ", successor=" + successor + "]";
    }
}
