package com.neptune.query.api.concurrency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.neptune.query.api.clients.NeptuneApiException;
import com.neptune.query.api.model.Page;

/**
 * Runs batch workers on a bounded pool and merges their pages.
 *
 * <p>The pool has a fixed number of threads shared by every query issued through it, so the
 * number of in-flight calls never exceeds it no matter how many batches are submitted. The
 * {@link QueryContext} is handed to each worker as an argument; the query id is also put in the
 * worker's MDC under {@value #MDC_QUERY_ID} for log correlation only.
 *
 * <p>The first failing batch aborts the whole operation: outstanding batches are cancelled,
 * pages already collected are dropped and the error is rethrown to the caller.
 */
public class FanOutExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FanOutExecutor.class);

    public static final String MDC_QUERY_ID = "queryId";

    private static final AtomicInteger poolCounter = new AtomicInteger();

    private final ExecutorService executor;
    private final int maxWorkers;

    public FanOutExecutor(int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, got " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.executor = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory());
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Fetches every batch and returns all pages, grouped by batch in submission order.
     *
     * @param operation name used in logs and errors
     * @param batches   work items, typically from the batch splitter
     * @param context   per-query context passed to every worker
     * @param worker    turns one batch into pages
     * @throws NeptuneApiException the first error raised by any batch
     */
    public <B, R> List<Page<R>> fetchAll(String operation, List<B> batches, QueryContext context,
                                         BatchWorker<B, R> worker) {
        if (batches.isEmpty()) {
            return Collections.emptyList();
        }
        long start = System.currentTimeMillis();

        AtomicBoolean aborted = new AtomicBoolean(false);
        CompletionService<BatchResult<R>> completion = new ExecutorCompletionService<>(executor);
        List<Future<BatchResult<R>>> futures = new ArrayList<>(batches.size());

        for (int i = 0; i < batches.size(); i++) {
            int index = i;
            B batch = batches.get(i);
            futures.add(completion.submit(() -> runBatch(index, batch, context, worker, aborted)));
        }

        List<List<Page<R>>> byBatch = new ArrayList<>(Collections.nCopies(batches.size(), null));
        try {
            for (int done = 0; done < batches.size(); done++) {
                BatchResult<R> result = completion.take().get();
                byBatch.set(result.index, result.pages);
            }
        } catch (ExecutionException e) {
            abort(aborted, futures);
            throw unwrap(operation, context, e.getCause());
        } catch (InterruptedException e) {
            abort(aborted, futures);
            Thread.currentThread().interrupt();
            throw new NeptuneApiException("Interrupted while waiting for " + operation, e);
        } catch (CancellationException e) {
            abort(aborted, futures);
            throw new NeptuneApiException(operation + " was cancelled", e);
        }

        List<Page<R>> merged = new ArrayList<>();
        for (List<Page<R>> pages : byBatch) {
            merged.addAll(pages);
        }
        logger.debug("{} [{}]: {} batches, {} pages in {} ms", operation, context.getQueryId(),
                batches.size(), merged.size(), System.currentTimeMillis() - start);
        return merged;
    }

    private static <B, R> BatchResult<R> runBatch(int index, B batch, QueryContext context,
                                                   BatchWorker<B, R> worker, AtomicBoolean aborted) {
        MDC.put(MDC_QUERY_ID, context.getQueryId());
        try {
            List<Page<R>> pages = new ArrayList<>();
            Iterator<Page<R>> it = worker.fetch(batch, context);
            while (!aborted.get() && it.hasNext()) {
                pages.add(it.next());
            }
            return new BatchResult<>(index, pages);
        } finally {
            MDC.remove(MDC_QUERY_ID);
        }
    }

    private static void abort(AtomicBoolean aborted, List<? extends Future<?>> futures) {
        aborted.set(true);
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static NeptuneApiException unwrap(String operation, QueryContext context, Throwable cause) {
        if (cause instanceof NeptuneApiException) {
            logger.debug("{} [{}] aborted: {}", operation, context.getQueryId(), cause.getMessage());
            return (NeptuneApiException) cause;
        }
        logger.error("{} [{}] failed in a worker: {}", operation, context.getQueryId(), cause.toString());
        return new FanOutException(operation + " failed: " + cause, cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class BatchResult<R> {
        private final int index;
        private final List<Page<R>> pages;

        BatchResult(int index, List<Page<R>> pages) {
            this.index = index;
            this.pages = pages;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final int poolId = poolCounter.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "neptune-query-" + poolId + "-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
