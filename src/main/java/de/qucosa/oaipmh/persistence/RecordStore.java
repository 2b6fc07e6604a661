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

import java.util.List;

/**
 * Read access to the repository's records, as needed for paged harvesting.
 */
public interface RecordStore {

    /**
     * Fetch the next records of a harvest.
     * <p>
     * Implementations must return records strictly after {@link RecordRangeQuery#getAfter()},
     * ordered ascending by datestamp and then by identifier (compared by UTF-16 code units,
     * like {@link String#compareTo(String)}), and at most {@link RecordRangeQuery#getLimit()}
     * of them. Records not available in the requested format may be returned without
     * metadata; tombstones are returned whatever the format.
     *
     * @param query window, position and limit of the records to fetch
     * @return the matching records, may be empty but never {@code null}
     * @throws PersistenceException if the store cannot be read
     */
    public List<HarvestRecord> findRecords(RecordRangeQuery query) throws PersistenceException;
}
