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

import org.eclipse.jdt.annotation.Nullable;

/**
 * Failure kinds of a paged harvest request and the OAI-PMH error code each is reported as.
 */
public enum HarvestError {

    INVALID_FORMAT("cannotDisseminateFormat", false),
    INVALID_DATE_RANGE("badArgument", false),
    BAD_ARGUMENT("badArgument", false),
    BAD_RESUMPTION_TOKEN("badResumptionToken", false),
    NO_RECORDS_MATCH("noRecordsMatch", false),
    STORE_UNAVAILABLE(null, true);

    @Nullable
    private final String oaiErrorCode;
    private final boolean retryable;

    HarvestError(@Nullable String oaiErrorCode, boolean retryable) {
        this.oaiErrorCode = oaiErrorCode;
        this.retryable = retryable;
    }

    /**
     * @return the code of the OAI-PMH error element, {@code null} if the failure is not a
     * protocol error and has to be reported as a server side error (e.g. HTTP 503)
     */
    @Nullable
    public String getOaiErrorCode() {
        return oaiErrorCode;
    }

    /**
     * @return {@code true} if the same request may succeed when repeated later
     */
    public boolean isRetryable() {
        return retryable;
    }
}
