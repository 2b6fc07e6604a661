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

package de.qucosa.oaipmh.persistence;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link RecordStore} so that every query either completes within a fixed time or
 * fails with a {@link PersistenceException}. A timed out query is cancelled.
 * <p>
 * Queries run on a fixed number of worker threads. A query waiting for a free worker counts
 * against its timeout, so a store that hangs cannot make the pool grow.
 */
public class TimeLimitedRecordStore implements RecordStore {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final RecordStore delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    /**
     * @param delegate    the store to query
     * @param timeout     maximum duration of one query, positive
     * @param workerCount maximum number of queries running at the same time, positive
     * @throws IllegalArgumentException if delegate is {@code null} or timeout or workerCount
     *                                  is not positive
     */
    public TimeLimitedRecordStore(RecordStore delegate, Duration timeout, int workerCount)
            throws IllegalArgumentException {
        if (delegate == null)
            throw new IllegalArgumentException("parameter delegate must not be null");
        if (timeout == null || timeout.getMillis() <= 0)
            throw new IllegalArgumentException("parameter timeout must be a positive duration, was " + timeout);
        if (workerCount <= 0)
            throw new IllegalArgumentException("parameter workerCount must be positive, was " + workerCount);

        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory());
    }

    @Override
    public List<HarvestRecord> findRecords(final RecordRangeQuery query) throws PersistenceException {
        Future<List<HarvestRecord>> pending;
        try {
            pending = executor.submit(new Callable<List<HarvestRecord>>() {
                @Override
                public List<HarvestRecord> call() throws PersistenceException {
                    return delegate.findRecords(query);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new PersistenceException("Record store is shut down", e);
        }

        try {
            return pending.get(timeout.getMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new PersistenceException("Record store did not answer within " + timeout, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while waiting for the record store", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PersistenceException) {
                throw (PersistenceException) cause;
            }
            throw new PersistenceException("Record store query failed", cause);
        }
    }

    /**
     * Stop the worker threads. Queries still running are interrupted; later queries fail with
     * a {@link PersistenceException}.
     */
    public void shutdown() {
        logger.info("Shutting down record store workers");
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private static class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "record-store-query-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
