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
 * Malformed, missing, repeated or mutually exclusive request arguments.
 */
public class BadArgumentException extends HarvestException {

    private static final long serialVersionUID = 1L;

    public BadArgumentException(String message) {
        super(message);
    }

    @Override
    public HarvestError getError() {
        return HarvestError.BAD_ARGUMENT;
    }
}
