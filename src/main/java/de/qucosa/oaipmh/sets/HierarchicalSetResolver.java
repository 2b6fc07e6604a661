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
 * Colon separated set hierarchy of OAI-PMH 2.0, section 4.6: a record of set {@code a:b:c}
 * is also a member of {@code a:b} and {@code a}, but not of {@code a:bc}.
 */
public class HierarchicalSetResolver implements SetHierarchyResolver {

    public static final char HIERARCHY_SEPARATOR = ':';

    @Override
    public boolean matches(String setFilter, List<String> memberships) {
        String descendantPrefix = setFilter + HIERARCHY_SEPARATOR;
        for (String setSpec : memberships) {
            if (setSpec.equals(setFilter) || setSpec.startsWith(descendantPrefix)) {
                return true;
            }
        }
        return false;
    }
}
