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

package de.qucosa.oaipmh.query;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.eclipse.jdt.annotation.Nullable;

import de.qucosa.oaipmh.error.BadArgumentException;
import de.qucosa.oaipmh.token.ResumptionTokenCodec;

/**
 * Arguments of a ListRecords or ListIdentifiers request, exactly as sent by the harvester.
 * Every argument is optional here; which combinations are legal is decided by
 * {@link QueryNormalizer} and {@link de.qucosa.oaipmh.harvest.HarvestOrchestrator}.
 */
public class HarvestRequest {

    public static final String VERB = "verb";
    public static final String IDENTIFIER = "identifier";
    public static final String METADATA_PREFIX = "metadataPrefix";
    public static final String SET = "set";
    public static final String FROM = "from";
    public static final String UNTIL = "until";
    public static final String RESUMPTION_TOKEN = "resumptionToken";

    public static final String LIST_RECORDS = "ListRecords";
    public static final String LIST_IDENTIFIERS = "ListIdentifiers";

    /**
     * Longest query string accepted, not counting the value of a resumptionToken argument.
     * Resumption tokens are limited to {@link ResumptionTokenCodec#MAX_TOKEN_LENGTH} on their own.
     */
    public static final int MAX_QUERY_LENGTH = 1000;

    private static final Set<String> ALLOWED_ARGUMENTS = new HashSet<>(Arrays.asList(
            VERB, IDENTIFIER, METADATA_PREFIX, SET, FROM, UNTIL, RESUMPTION_TOKEN));

    @Nullable
    private final String verb;
    @Nullable
    private final String identifier;
    @Nullable
    private final String metadataPrefix;
    @Nullable
    private final String set;
    @Nullable
    private final String from;
    @Nullable
    private final String until;
    @Nullable
    private final String resumptionToken;

    private HarvestRequest(Builder builder) {
        this.verb = builder.verb;
        this.identifier = builder.identifier;
        this.metadataPrefix = builder.metadataPrefix;
        this.set = builder.set;
        this.from = builder.from;
        this.until = builder.until;
        this.resumptionToken = builder.resumptionToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse the query string of a GET request or the body of a form encoded POST request.
     *
     * @param queryString {@code application/x-www-form-urlencoded} arguments, without a
     *                    leading {@code ?}
     * @return the request, never {@code null}
     * @throws BadArgumentException if the query string without the resumptionToken value is
     *                              longer than {@value #MAX_QUERY_LENGTH} characters, contains
     *                              an unknown argument, an argument without value or a
     *                              repeated argument
     */
    public static HarvestRequest fromQueryString(@Nullable String queryString) throws BadArgumentException {
        if (queryString == null || queryString.isEmpty()) {
            return builder().build();
        }
        if (queryString.length() > MAX_QUERY_LENGTH + ResumptionTokenCodec.MAX_TOKEN_LENGTH) {
            throw new BadArgumentException("Request arguments exceed " + MAX_QUERY_LENGTH + " characters");
        }

        Map<String, String> arguments = new HashMap<>();
        List<NameValuePair> pairs = URLEncodedUtils.parse(queryString, StandardCharsets.UTF_8);
        for (NameValuePair pair : pairs) {
            if (!ALLOWED_ARGUMENTS.contains(pair.getName())) {
                throw new BadArgumentException("Illegal argument '" + pair.getName() + "'");
            }
            if (pair.getValue() == null || pair.getValue().isEmpty()) {
                throw new BadArgumentException("Argument '" + pair.getName() + "' has no value");
            }
            if (arguments.put(pair.getName(), pair.getValue()) != null) {
                throw new BadArgumentException("Argument '" + pair.getName() + "' must not be repeated");
            }
        }
        String resumptionToken = arguments.get(RESUMPTION_TOKEN);
        int argumentsLength = queryString.length() - (resumptionToken == null ? 0 : resumptionToken.length());
        if (argumentsLength > MAX_QUERY_LENGTH) {
            throw new BadArgumentException("Request arguments exceed " + MAX_QUERY_LENGTH + " characters");
        }

        return builder()
                .setVerb(arguments.get(VERB))
                .setIdentifier(arguments.get(IDENTIFIER))
                .setMetadataPrefix(arguments.get(METADATA_PREFIX))
                .setSet(arguments.get(SET))
                .setFrom(arguments.get(FROM))
                .setUntil(arguments.get(UNTIL))
                .setResumptionToken(resumptionToken)
                .build();
    }

    @Nullable
    public String getVerb() {
        return verb;
    }

    @Nullable
    public String getIdentifier() {
        return identifier;
    }

    @Nullable
    public String getMetadataPrefix() {
        return metadataPrefix;
    }

    @Nullable
    public String getSet() {
        return set;
    }

    @Nullable
    public String getFrom() {
        return from;
    }

    @Nullable
    public String getUntil() {
        return until;
    }

    @Nullable
    public String getResumptionToken() {
        return resumptionToken;
    }

    public boolean hasResumptionToken() {
        return resumptionToken != null;
    }

    /**
     * @return {@code true} if any of metadataPrefix, set, from or until is present
     */
    public boolean hasSelectiveHarvestingArguments() {
        return metadataPrefix != null || set != null || from != null || until != null;
    }

    @Override
    public String toString() {
        return "HarvestRequest [verb=" + verb + ", identifier=" + identifier + ", metadataPrefix=" + metadataPrefix
                + ", set=" + set + ", from=" + from + ", until=" + until + ", resumptionToken="
                + (resumptionToken == null ? null : "<" + resumptionToken.length() + " chars>") + "]";
    }

    public static class Builder {
        private String verb;
        private String identifier;
        private String metadataPrefix;
        private String set;
        private String from;
        private String until;
        private String resumptionToken;

        private Builder() {
        }

        public Builder setVerb(@Nullable String verb) {
            this.verb = verb;
            return this;
        }

        public Builder setIdentifier(@Nullable String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder setMetadataPrefix(@Nullable String metadataPrefix) {
            this.metadataPrefix = metadataPrefix;
            return this;
        }

        public Builder setSet(@Nullable String set) {
            this.set = set;
            return this;
        }

        public Builder setFrom(@Nullable String from) {
            this.from = from;
            return this;
        }

        public Builder setUntil(@Nullable String until) {
            this.until = until;
            return this;
        }

        public Builder setResumptionToken(@Nullable String resumptionToken) {
            this.resumptionToken = resumptionToken;
            return this;
        }

        public HarvestRequest build() {
            return new HarvestRequest(this);
        }
    }
}
