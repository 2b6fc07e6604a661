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

/**
 * Repository-wide support for deleted records, as declared in the Identify response.
 */
public enum DeletedRecordPolicy {

    NO("no"),
    TRANSIENT("transient"),
    PERSISTENT("persistent");

    private final String value;

    DeletedRecordPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return {@code true} if tombstones are reported to harvesters
     */
    public boolean reportsDeletions() {
        return this != NO;
    }

    /**
     * @param value one of {@code no}, {@code transient}, {@code persistent}
     * @throws IllegalArgumentException for any other value
     */
    public static DeletedRecordPolicy fromValue(String value) throws IllegalArgumentException {
        for (DeletedRecordPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Invalid deletedRecord value '" + value
                + "'. Allowed values are: no, transient, persistent");
    }
}
