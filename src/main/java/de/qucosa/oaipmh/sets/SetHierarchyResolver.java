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

package de.qucosa.oaipmh.sets;

import java.util.List;

/**
 * Decides whether a record belongs to a requested set.
 */
public interface SetHierarchyResolver {

    /**
     * @param setFilter   the setSpec of the request
     * @param memberships the setSpecs a record is a member of
     * @return {@code true} if the record belongs to setFilter
     */
    public boolean matches(String setFilter, List<String> memberships);
}
