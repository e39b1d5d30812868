package org.aipomoea.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyUtilsTest {

    private record CommandOutcome(String command) {
    }

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        if (executor != null && !executor.isTerminated())
            ConcurrencyUtils.shutdownExecutorService(executor, "tearDownExecutor");
    }

    @Test
    void testWaitForCompletableFuturesAndCollect_emptyList() {
        List<CommandOutcome> results = ConcurrencyUtils.waitForCompletableFuturesAndCollect("Command", List.of(), "empty");
        assertTrue(results.isEmpty());
    }

    @Test
    @Timeout(value = 2, unit = TimeUnit.SECONDS)
    void testWaitForCompletableFuturesAndCollect_failedFutureIsSkipped() {
        List<CompletableFuture<CommandOutcome>> futures = new ArrayList<>();
        futures.add(CompletableFuture.supplyAsync(() -> new CommandOutcome("leaf_area"), executor));
        futures.add(CompletableFuture.supplyAsync(() -> {
            throw new CompletionException("binary vanished", new IllegalStateException("gone"));
        }, executor));
        futures.add(CompletableFuture.supplyAsync(() -> new CommandOutcome("disease"), executor));

        List<CommandOutcome> results = ConcurrencyUtils.waitForCompletableFuturesAndCollect("Command", futures, "oneFails");

        assertEquals(List.of(new CommandOutcome("leaf_area"), new CommandOutcome("disease")), results,
                "results keep submission order and skip the failure");
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testCollectAsCompleted_returnsInCompletionOrder() throws Exception {
        CountDownLatch fastDone = new CountDownLatch(1);
        List<Callable<String>> tasks = List.of(
                () -> {
                    fastDone.await();
                    Thread.sleep(100);
                    return "slow";
                },
                () -> {
                    fastDone.countDown();
                    return "fast";
                });

        List<String> results = ConcurrencyUtils.collectAsCompleted("Batch", executor, tasks, "order");

        assertEquals(List.of("fast", "slow"), results);
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testCollectAsCompleted_failingTaskContributesNothing() throws Exception {
        List<Callable<String>> tasks = List.of(
                () -> "1",
                () -> {
                    throw new IllegalStateException("batch exploded");
                },
                () -> "3");

        List<String> results = ConcurrencyUtils.collectAsCompleted("Batch", executor, tasks, "fail");

        assertEquals(2, results.size());
        assertTrue(results.containsAll(List.of("1", "3")));
    }

    @Test
    void testCreatePlatformThreadFactory_numbersThreads() {
        ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory("CommandExec-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("CommandExec-1", first.getName());
        assertEquals("CommandExec-2", second.getName());
        assertFalse(first.isDaemon());
    }

    @Test
    void testShutdownExecutorService_nullExecutor() {
        assertDoesNotThrow(() -> ConcurrencyUtils.shutdownExecutorService(null, "NullExecutor"));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_waitsForRunningWork() {
        ExecutorService local = Executors.newFixedThreadPool(1);
        local.submit(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        ConcurrencyUtils.shutdownExecutorService(local, "NormalShutdown");

        assertTrue(local.isTerminated());
    }
}
