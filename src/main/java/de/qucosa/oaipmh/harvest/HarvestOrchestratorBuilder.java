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

package de.qucosa.oaipmh.harvest;

import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeUtils.MillisProvider;
import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.config.PaginationProperties;
import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.cursor.DeletedRecordPolicy;
import de.qucosa.oaipmh.cursor.Granularity;
import de.qucosa.oaipmh.paging.PageProducer;
import de.qucosa.oaipmh.persistence.RecordStore;
import de.qucosa.oaipmh.persistence.TimeLimitedRecordStore;
import de.qucosa.oaipmh.query.ConfiguredFormatRegistry;
import de.qucosa.oaipmh.query.FormatRegistry;
import de.qucosa.oaipmh.query.QueryNormalizer;
import de.qucosa.oaipmh.sets.HierarchicalSetResolver;
import de.qucosa.oaipmh.sets.SetHierarchyResolver;
import de.qucosa.oaipmh.token.ResumptionTokenCodec;
import de.qucosa.oaipmh.token.SigningKeySource;
import de.qucosa.oaipmh.token.StaticSigningKeySource;

public class HarvestOrchestratorBuilder {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final Duration DEFAULT_TOKEN_TIME_TO_LIVE = Duration.standardHours(24);
    public static final Duration DEFAULT_STORE_QUERY_TIMEOUT = Duration.standardSeconds(30);
    public static final int DEFAULT_STORE_WORKER_COUNT = 10;
    public static final Granularity DEFAULT_REPOSITORY_GRANULARITY = Granularity.SECOND;
    public static final DeletedRecordPolicy DEFAULT_DELETED_RECORD_POLICY = DeletedRecordPolicy.TRANSIENT;

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final RecordStore recordStore;
    private final FormatRegistry formatRegistry;
    private final SigningKeySource signingKeySource;

    private int pageSize = DEFAULT_PAGE_SIZE;
    private Duration tokenTimeToLive = DEFAULT_TOKEN_TIME_TO_LIVE;
    private Duration storeQueryTimeout = DEFAULT_STORE_QUERY_TIMEOUT;
    private int storeWorkerCount = DEFAULT_STORE_WORKER_COUNT;
    private Granularity repositoryGranularity = DEFAULT_REPOSITORY_GRANULARITY;
    private DeletedRecordPolicy deletedRecordPolicy = DEFAULT_DELETED_RECORD_POLICY;
    private SetHierarchyResolver setHierarchyResolver = new HierarchicalSetResolver();
    private MillisProvider clock = DateTimeUtils.SYSTEM_MILLIS_PROVIDER;

    /**
     * @param recordStore      the records to harvest
     * @param formatRegistry   the formats the repository supports
     * @param signingKeySource keys for signing resumption tokens
     */
    public HarvestOrchestratorBuilder(RecordStore recordStore, FormatRegistry formatRegistry,
                                      SigningKeySource signingKeySource) {
        this.recordStore = recordStore;
        this.formatRegistry = formatRegistry;
        this.signingKeySource = signingKeySource;
    }

    /**
     * Create a builder with format registry, signing keys and settings taken from properties.
     *
     * @throws IllegalArgumentException if the properties contain no usable signing key, no
     *                                  metadata format or an invalid value
     */
    public static HarvestOrchestratorBuilder fromProperties(PaginationProperties properties, RecordStore recordStore)
            throws IllegalArgumentException {
        return new HarvestOrchestratorBuilder(recordStore,
                new ConfiguredFormatRegistry(properties.getMetadataFormats()),
                StaticSigningKeySource.fromBase64(properties.getTokenKey(), properties.getTokenPreviousKey()))
                .configure(properties);
    }

    /**
     * Apply page size, repository granularity, deleted record policy, token lifetime, store
     * query timeout and store worker count from properties. A store query timeout of 0 keeps
     * the current value.
     *
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder configure(PaginationProperties properties) {
        setPageSize(properties.getPageSize());
        setRepositoryGranularity(properties.getRepositoryGranularity());
        setDeletedRecordPolicy(properties.getDeletedRecordPolicy());
        setTokenTimeToLive(properties.getTokenTimeToLive());
        if (properties.getStoreQueryTimeoutSeconds() > 0) {
            setStoreQueryTimeout(Duration.standardSeconds(properties.getStoreQueryTimeoutSeconds()));
        }
        setStoreWorkerCount(properties.getStoreWorkerCount());
        return this;
    }

    /**
     * @throws IllegalStateException if the store query timeout is not shorter than the token
     *                               lifetime or a required collaborator is missing
     */
    public HarvestOrchestrator build() throws IllegalStateException {
        if (recordStore == null || formatRegistry == null || signingKeySource == null)
            throw new IllegalStateException("recordStore, formatRegistry and signingKeySource must be set");
        if (!storeQueryTimeout.isShorterThan(tokenTimeToLive))
            throw new IllegalStateException("store query timeout " + storeQueryTimeout
                    + " must be shorter than token time to live " + tokenTimeToLive);

        logger.info("Paging with page size {}, token time to live {}, store query timeout {} on {} workers, "
                        + "granularity {}, deleted records {}", pageSize, tokenTimeToLive, storeQueryTimeout,
                storeWorkerCount, repositoryGranularity, deletedRecordPolicy.getValue());

        QueryNormalizer queryNormalizer = new QueryNormalizer(formatRegistry, repositoryGranularity, pageSize,
                tokenTimeToLive, clock);
        ResumptionTokenCodec tokenCodec = new ResumptionTokenCodec(signingKeySource, clock);
        TimeLimitedRecordStore timeLimitedStore = new TimeLimitedRecordStore(recordStore, storeQueryTimeout,
                storeWorkerCount);
        PageProducer pageProducer = new PageProducer(timeLimitedStore, setHierarchyResolver, deletedRecordPolicy, clock);
        return new HarvestOrchestrator(queryNormalizer, tokenCodec, pageProducer, timeLimitedStore);
    }

    /**
     * @param pageSize number of records per page, between 1 and {@link Cursor#MAX_PAGE_SIZE}
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     * @throws IllegalArgumentException if pageSize is out of range
     */
    public HarvestOrchestratorBuilder setPageSize(int pageSize) throws IllegalArgumentException {
        if (pageSize <= 0 || pageSize > Cursor.MAX_PAGE_SIZE)
            throw new IllegalArgumentException("parameter pageSize must be between 1 and " + Cursor.MAX_PAGE_SIZE
                    + ", was " + pageSize);
        this.pageSize = pageSize;
        return this;
    }

    /**
     * @param tokenTimeToLive how long a resumption token stays valid after it was issued
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setTokenTimeToLive(Duration tokenTimeToLive) {
        this.tokenTimeToLive = tokenTimeToLive;
        return this;
    }

    /**
     * @param storeQueryTimeout maximum duration of one record store query
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setStoreQueryTimeout(Duration storeQueryTimeout) {
        this.storeQueryTimeout = storeQueryTimeout;
        return this;
    }

    /**
     * @param storeWorkerCount maximum number of record store queries running at the same time
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     * @throws IllegalArgumentException if storeWorkerCount is not positive
     */
    public HarvestOrchestratorBuilder setStoreWorkerCount(int storeWorkerCount) throws IllegalArgumentException {
        if (storeWorkerCount <= 0)
            throw new IllegalArgumentException("parameter storeWorkerCount must be positive, was " + storeWorkerCount);
        this.storeWorkerCount = storeWorkerCount;
        return this;
    }

    /**
     * @param repositoryGranularity finest granularity of the repository's datestamps
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setRepositoryGranularity(Granularity repositoryGranularity) {
        this.repositoryGranularity = repositoryGranularity;
        return this;
    }

    /**
     * @param deletedRecordPolicy whether tombstones are reported
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setDeletedRecordPolicy(DeletedRecordPolicy deletedRecordPolicy) {
        this.deletedRecordPolicy = deletedRecordPolicy;
        return this;
    }

    /**
     * @param setHierarchyResolver decides set membership
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setSetHierarchyResolver(SetHierarchyResolver setHierarchyResolver) {
        this.setHierarchyResolver = setHierarchyResolver;
        return this;
    }

    /**
     * @param clock source of the current time, for tests
     * @return this {@link HarvestOrchestratorBuilder} instance, never {@code null}.
     */
    public HarvestOrchestratorBuilder setClock(MillisProvider clock) {
        this.clock = clock;
        return this;
    }

    public int getPageSize() {
        return pageSize;
    }

    public Duration getTokenTimeToLive() {
        return tokenTimeToLive;
    }

    public Duration getStoreQueryTimeout() {
        return storeQueryTimeout;
    }

    public int getStoreWorkerCount() {
        return storeWorkerCount;
    }

    public Granularity getRepositoryGranularity() {
        return repositoryGranularity;
    }

    public DeletedRecordPolicy getDeletedRecordPolicy() {
        return deletedRecordPolicy;
    }
}
