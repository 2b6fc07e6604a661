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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.qucosa.oaipmh.cursor.Cursor;
import de.qucosa.oaipmh.error.BadArgumentException;
import de.qucosa.oaipmh.error.HarvestException;
import de.qucosa.oaipmh.paging.PageProducer;
import de.qucosa.oaipmh.paging.ProducedPage;
import de.qucosa.oaipmh.persistence.HarvestRecord;
import de.qucosa.oaipmh.persistence.TimeLimitedRecordStore;
import de.qucosa.oaipmh.query.HarvestRequest;
import de.qucosa.oaipmh.query.QueryNormalizer;
import de.qucosa.oaipmh.token.ResumptionTokenCodec;

/**
 * Entry point of the pagination engine. A request either starts a harvest, then its arguments
 * are normalized into the first cursor, or continues one, then its resumption token is
 * decoded into the cursor. Both kinds of requests are answered by the same
 * {@link PageProducer}; the successor cursor is handed out as a new resumption token.
 * <p>
 * Instances hold no per-harvest state and may be shared by concurrent requests. Use
 * {@link HarvestOrchestratorBuilder} to create one.
 */
public class HarvestOrchestrator {

    static final String EXCLUSIVE_TOKEN_MESSAGE = "resumptionToken is exclusive of other parameters";

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final QueryNormalizer queryNormalizer;
    private final ResumptionTokenCodec tokenCodec;
    private final PageProducer pageProducer;
    private final TimeLimitedRecordStore recordStore;

    /**
     * @param recordStore the store the page producer reads from, shut down with this
     *                    orchestrator
     */
    public HarvestOrchestrator(QueryNormalizer queryNormalizer, ResumptionTokenCodec tokenCodec,
                               PageProducer pageProducer, TimeLimitedRecordStore recordStore) {
        if (queryNormalizer == null)
            throw new IllegalArgumentException("parameter queryNormalizer must not be null");
        if (tokenCodec == null)
            throw new IllegalArgumentException("parameter tokenCodec must not be null");
        if (pageProducer == null)
            throw new IllegalArgumentException("parameter pageProducer must not be null");
        if (recordStore == null)
            throw new IllegalArgumentException("parameter recordStore must not be null");

        this.queryNormalizer = queryNormalizer;
        this.tokenCodec = tokenCodec;
        this.pageProducer = pageProducer;
        this.recordStore = recordStore;
    }

    /**
     * @param request arguments of a ListRecords or ListIdentifiers request
     * @return the requested page, never {@code null}
     * @throws HarvestException if the request is invalid, the token is bad or expired, no
     *                          records match, or the record store is unavailable
     */
    public HarvestPage produceNextPage(HarvestRequest request) throws HarvestException {
        if (request == null)
            throw new IllegalArgumentException("parameter request must not be null");

        checkVerb(request);
        if (request.getIdentifier() != null) {
            throw new BadArgumentException("Argument 'identifier' is not allowed for verb " + request.getVerb());
        }

        Cursor cursor;
        boolean continuation = request.hasResumptionToken();
        if (continuation) {
            if (request.hasSelectiveHarvestingArguments()) {
                throw new BadArgumentException(EXCLUSIVE_TOKEN_MESSAGE);
            }
            cursor = tokenCodec.decode(request.getResumptionToken());
            logger.debug("Continuing harvest at {}", cursor.getWatermark());
        } else {
            cursor = queryNormalizer.normalize(request);
            logger.debug("Starting harvest of format {}", cursor.getMetadataFormat());
        }

        ProducedPage produced = pageProducer.produce(cursor);
        Cursor successor = produced.getSuccessor();

        List<HarvestRecord> records = produced.getRecords();
        if (HarvestRequest.LIST_IDENTIFIERS.equals(request.getVerb())) {
            records = headersOnly(records);
        }

        HarvestPage page = (successor == null)
                ? new HarvestPage(records, null, null, cursor.getDeliveredCount(), continuation)
                : new HarvestPage(records, tokenCodec.encode(successor), successor.getExpirationDate(),
                cursor.getDeliveredCount(), false);
        logger.debug("Produced {}", page);
        return page;
    }

    /**
     * Release the record store's worker threads. Requests after shutdown fail with
     * {@link de.qucosa.oaipmh.error.StoreUnavailableException}.
     */
    public void shutdown() {
        recordStore.shutdown();
        logger.info("Shut down completed");
    }

    private void checkVerb(HarvestRequest request) throws BadArgumentException {
        String verb = request.getVerb();
        if (verb != null && !HarvestRequest.LIST_RECORDS.equals(verb) && !HarvestRequest.LIST_IDENTIFIERS.equals(verb)) {
            throw new BadArgumentException("Verb '" + verb + "' does not support selective harvesting");
        }
    }

    private List<HarvestRecord> headersOnly(List<HarvestRecord> records) {
        List<HarvestRecord> headers = new ArrayList<>(records.size());
        for (HarvestRecord record : records) {
            headers.add(record.withoutMetadata());
        }
        return headers;
    }
}
