package com.neptune.query.api.concurrency;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import com.neptune.query.api.clients.AuthorizationException;
import com.neptune.query.api.clients.NeptuneApiException;
import com.neptune.query.api.model.Page;

public class FanOutExecutorTest {

    private FanOutExecutor executor;
    private QueryContext context;

    @BeforeEach
    public void setUp() {
        executor = new FanOutExecutor(4);
        context = new QueryContext("token", new QueryMetadata("fetch_metrics", "nq-java/test", "abcd1234", null));
    }

    @AfterEach
    public void tearDown() {
        executor.close();
    }

    private static Iterator<Page<Integer>> pagesOf(List<Integer> batch) {
        List<Page<Integer>> pages = new ArrayList<>();
        for (Integer item : batch) {
            pages.add(new Page<>(Collections.singletonList(item)));
        }
        return pages.iterator();
    }

    @Test
    public void testPagesAreGroupedByBatchInSubmissionOrder() {
        List<List<Integer>> batches = Arrays.asList(
                Arrays.asList(1, 2), Arrays.asList(3), Arrays.asList(4, 5, 6), Arrays.asList(7));

        List<Page<Integer>> pages = executor.fetchAll("test", batches, context, (batch, ctx) -> {
            if (batch.get(0) == 1) {
                sleepQuietly(50);
            }
            return pagesOf(batch);
        });

        List<Integer> items = new ArrayList<>();
        for (Page<Integer> page : pages) {
            items.addAll(page.getItems());
        }
        assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6, 7), items);
    }

    @Test
    public void testContextIsPassedToEveryWorker() {
        Set<String> seenQueryIds = ConcurrentHashMap.newKeySet();
        Set<String> seenMdc = ConcurrentHashMap.newKeySet();
        Set<String> seenTokens = ConcurrentHashMap.newKeySet();

        executor.fetchAll("test", Arrays.asList(Arrays.asList(1), Arrays.asList(2), Arrays.asList(3)), context,
                (List<Integer> batch, QueryContext ctx) -> {
                    seenQueryIds.add(ctx.getQueryId());
                    seenTokens.add(ctx.getApiToken());
                    String mdc = MDC.get(FanOutExecutor.MDC_QUERY_ID);
                    seenMdc.add(mdc == null ? "<none>" : mdc);
                    return pagesOf(batch);
                });

        assertEquals(Collections.singleton("abcd1234"), seenQueryIds);
        assertEquals(Collections.singleton("token"), seenTokens);
        assertEquals(Collections.singleton("abcd1234"), seenMdc);
    }

    @Test
    public void testConcurrencyIsBounded() {
        executor.close();
        executor = new FanOutExecutor(2);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        List<List<Integer>> batches = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            batches.add(Collections.singletonList(i));
        }

        List<Page<Integer>> pages = executor.fetchAll("test", batches, context, (batch, ctx) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            sleepQuietly(20);
            active.decrementAndGet();
            return pagesOf(batch);
        });

        assertEquals(10, pages.size());
        assertTrue(maxActive.get() <= 2, "max active workers was " + maxActive.get());
        assertEquals(2, executor.getMaxWorkers());
    }

    @Test
    public void testApiErrorIsRethrownUnchanged() {
        AuthorizationException failure = new AuthorizationException("denied", 401, "bad token");

        NeptuneApiException thrown = assertThrows(NeptuneApiException.class, () ->
                executor.fetchAll("test", Arrays.asList(Arrays.asList(1), Arrays.asList(2)), context,
                        (List<Integer> batch, QueryContext ctx) -> {
                            if (batch.get(0) == 2) {
                                throw failure;
                            }
                            return pagesOf(batch);
                        }));

        assertSame(failure, thrown);
    }

    @Test
    public void testOtherErrorsAreWrapped() {
        FanOutException thrown = assertThrows(FanOutException.class, () ->
                executor.fetchAll("test", Arrays.asList(Arrays.asList(1)), context,
                        (List<Integer> batch, QueryContext ctx) -> {
                            throw new IllegalStateException("broken worker");
                        }));

        assertTrue(thrown.getCause() instanceof IllegalStateException);
    }

    @Test
    public void testFailureCancelsOutstandingBatches() throws InterruptedException {
        CountDownLatch blockedStarted = new CountDownLatch(1);
        CountDownLatch blockedInterrupted = new CountDownLatch(1);
        CountDownLatch neverReleased = new CountDownLatch(1);
        AtomicBoolean blockedFinishedNormally = new AtomicBoolean(false);

        assertThrows(AuthorizationException.class, () ->
                executor.fetchAll("test", Arrays.asList(Arrays.asList(1), Arrays.asList(2)), context,
                        (List<Integer> batch, QueryContext ctx) -> {
                            if (batch.get(0) == 1) {
                                blockedStarted.countDown();
                                try {
                                    neverReleased.await();
                                    blockedFinishedNormally.set(true);
                                } catch (InterruptedException e) {
                                    blockedInterrupted.countDown();
                                }
                                return pagesOf(batch);
                            }
                            try {
                                blockedStarted.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            throw new AuthorizationException("denied", 403, "");
                        }));

        assertTrue(blockedInterrupted.await(5, TimeUnit.SECONDS));
        assertFalse(blockedFinishedNormally.get());
    }

    @Test
    public void testEmptyInputSubmitsNothing() {
        AtomicInteger calls = new AtomicInteger();
        List<Page<Integer>> pages = executor.fetchAll("test", Collections.<List<Integer>>emptyList(), context,
                (batch, ctx) -> {
                    calls.incrementAndGet();
                    return pagesOf(batch);
                });

        assertTrue(pages.isEmpty());
        assertEquals(0, calls.get());
    }

    @Test
    public void testInvalidWorkerCount() {
        assertThrows(IllegalArgumentException.class, () -> new FanOutExecutor(0));
        assertThrows(IllegalArgumentException.class, () -> new FanOutExecutor(-3));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
