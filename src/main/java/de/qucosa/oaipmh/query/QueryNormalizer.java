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

import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.Nullable;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils.MillisProvider;
import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.cursor.Granularity;
import de.qucosa.oaipmh.error.BadArgumentException;
import de.qucosa.oaipmh.error.HarvestException;
import de.qucosa.oaipmh.error.InvalidDateRangeException;
import de.qucosa.oaipmh.error.InvalidFormatException;

/**
 * Validates the selective harvesting arguments of a first request and turns them into the
 * harvest's initial {@link Cursor}. Requests carrying a resumption token never get here.
 */
public class QueryNormalizer {

    static final Pattern METADATA_PREFIX_PATTERN = Pattern.compile("[A-Za-z0-9\\-_.!~*'()]+");
    static final Pattern SET_SPEC_PATTERN = Pattern.compile("[A-Za-z0-9\\-_.]+(:[A-Za-z0-9\\-_.]+)*");

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final FormatRegistry formatRegistry;
    private final Granularity repositoryGranularity;
    private final int pageSize;
    private final Duration tokenTimeToLive;
    private final MillisProvider clock;

    /**
     * @param formatRegistry        formats the repository can disseminate
     * @param repositoryGranularity finest granularity the repository supports
     * @param pageSize              records per page for new harvests
     * @param tokenTimeToLive       lifetime of every cursor issued for a new harvest
     * @param clock                 source of the cursor's issue time
     * @throws IllegalArgumentException if any parameter is {@code null}, pageSize is not
     *                                  between 1 and {@link Cursor#MAX_PAGE_SIZE} or
     *                                  tokenTimeToLive is not positive
     */
    public QueryNormalizer(FormatRegistry formatRegistry, Granularity repositoryGranularity, int pageSize,
                           Duration tokenTimeToLive, MillisProvider clock) throws IllegalArgumentException {
        if (formatRegistry == null)
            throw new IllegalArgumentException("parameter formatRegistry must not be null");
        if (repositoryGranularity == null)
            throw new IllegalArgumentException("parameter repositoryGranularity must not be null");
        if (pageSize <= 0 || pageSize > Cursor.MAX_PAGE_SIZE)
            throw new IllegalArgumentException("parameter pageSize must be between 1 and " + Cursor.MAX_PAGE_SIZE
                    + ", was " + pageSize);
        if (tokenTimeToLive == null || tokenTimeToLive.getMillis() <= 0)
            throw new IllegalArgumentException("parameter tokenTimeToLive must be a positive duration");
        if (clock == null)
            throw new IllegalArgumentException("parameter clock must not be null");

        this.formatRegistry = formatRegistry;
        this.repositoryGranularity = repositoryGranularity;
        this.pageSize = pageSize;
        this.tokenTimeToLive = tokenTimeToLive;
        this.clock = clock;
    }

    /**
     * @param request arguments of a ListRecords or ListIdentifiers request without
     *                resumptionToken
     * @return the cursor of the harvest's first page
     * @throws BadArgumentException       if metadataPrefix is missing or metadataPrefix or set
     *                                    is syntactically invalid or too long
     * @throws InvalidFormatException     if the format is not supported
     * @throws InvalidDateRangeException  if from or until cannot be parsed, they differ in
     *                                    granularity, are finer than the repository's
     *                                    granularity, or from is after until
     */
    public Cursor normalize(HarvestRequest request) throws HarvestException {
        String metadataPrefix = request.getMetadataPrefix();
        if (metadataPrefix == null) {
            throw new BadArgumentException("Missing required argument 'metadataPrefix'");
        }
        if (metadataPrefix.length() > Cursor.MAX_METADATA_FORMAT_LENGTH
                || !METADATA_PREFIX_PATTERN.matcher(metadataPrefix).matches()) {
            throw new BadArgumentException("Invalid metadataPrefix '" + metadataPrefix + "'");
        }
        String set = request.getSet();
        if (set != null && (set.length() > Cursor.MAX_SET_FILTER_LENGTH || !SET_SPEC_PATTERN.matcher(set).matches())) {
            throw new BadArgumentException("Invalid setSpec '" + set + "'");
        }
        if (!formatRegistry.exists(metadataPrefix)) {
            throw new InvalidFormatException(metadataPrefix);
        }

        Granularity granularity = determineGranularity(request.getFrom(), request.getUntil());
        DateTime from = parse(request.getFrom(), granularity, HarvestRequest.FROM);
        DateTime until = parse(request.getUntil(), granularity, HarvestRequest.UNTIL);
        if (from != null && until != null && from.isAfter(until)) {
            throw new InvalidDateRangeException("from " + request.getFrom() + " is after until " + request.getUntil());
        }

        Cursor cursor = Cursor.initial(metadataPrefix, set, from, until, granularity, pageSize,
                new DateTime(clock.getMillis(), DateTimeZone.UTC), tokenTimeToLive);
        logger.debug("Normalized {} to {}", request, cursor);
        return cursor;
    }

    private Granularity determineGranularity(@Nullable String from, @Nullable String until)
            throws InvalidDateRangeException {
        Granularity fromGranularity = detect(from, HarvestRequest.FROM);
        Granularity untilGranularity = detect(until, HarvestRequest.UNTIL);

        if (fromGranularity != null && untilGranularity != null && fromGranularity != untilGranularity) {
            throw new InvalidDateRangeException("from and until must have the same granularity");
        }
        Granularity granularity = (fromGranularity != null) ? fromGranularity : untilGranularity;
        if (granularity == null) {
            return repositoryGranularity;
        }
        if (granularity.isFinerThan(repositoryGranularity)) {
            throw new InvalidDateRangeException("Granularity " + granularity + " is not supported, the finest "
                    + "granularity of this repository is " + repositoryGranularity);
        }
        return granularity;
    }

    @Nullable
    private Granularity detect(@Nullable String datestamp, String argument) throws InvalidDateRangeException {
        if (datestamp == null) {
            return null;
        }
        Granularity granularity = Granularity.detect(datestamp);
        if (granularity == null) {
            throw new InvalidDateRangeException("Invalid datestamp '" + datestamp + "' for argument '" + argument + "'");
        }
        return granularity;
    }

    @Nullable
    private DateTime parse(@Nullable String datestamp, Granularity granularity, String argument)
            throws InvalidDateRangeException {
        if (datestamp == null) {
            return null;
        }
        try {
            return granularity.parse(datestamp);
        } catch (IllegalArgumentException e) {
            throw new InvalidDateRangeException("Invalid datestamp '" + datestamp + "' for argument '" + argument + "'", e);
        }
    }
}
