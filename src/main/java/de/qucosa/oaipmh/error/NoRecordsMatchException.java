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

package de.qucosa.oaipmh.error;

/**
 * The first page of a harvest would be empty.
 */
public class NoRecordsMatchException extends HarvestException {

    private static final long serialVersionUID = 1L;

    public NoRecordsMatchException() {
        super("The combination of the values of the from, until, set and metadataPrefix arguments results in an empty list.");
    }

    @Override
    public HarvestError getError() {
        return HarvestError.NO_RECORDS_MATCH;
    }
}
