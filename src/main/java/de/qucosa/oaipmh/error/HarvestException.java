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
 * Base of all failures a harvest request can end with. Each subclass maps to exactly one
 * {@link HarvestError}.
 */
public abstract class HarvestException extends Exception {

    private static final long serialVersionUID = 1L;

    protected HarvestException(String message) {
        super(message);
    }

    protected HarvestException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HarvestError getError();
}
