package com.di.snapdiff.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs independent per-item work on a bounded pool with MDC propagation.
 *
 * <p>Every item runs to completion even when some fail; failures are collected and raised
 * together afterwards, the first as the cause and the rest as suppressed exceptions.
 */
@Slf4j
public final class ParallelTasks {

    private static final long STAGE_TIMEOUT_HOURS = 4;

    private ParallelTasks() {
    }

    /**
     * @return results in input order
     * @throws IllegalArgumentException when {@code maxWorkers} is below 1
     */
    public static <T, R> List<R> map(String stage, int maxWorkers, List<T> items, Function<T, R> work) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1 but was " + maxWorkers);
        }
        if (items.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(maxWorkers, items.size());
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, stage + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(workers, tf));

        ConcurrentLinkedQueue<RuntimeException> errors = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> work.apply(item), executor)
                    // keep allOf() waiting for every item, not just the first failure
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        errors.add(cause instanceof RuntimeException re ? re : new IllegalStateException(cause));
                        return null;
                    }));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(STAGE_TIMEOUT_HOURS, TimeUnit.HOURS);
        } catch (TimeoutException e) {
            throw new IllegalStateException(stage + " timed out after " + STAGE_TIMEOUT_HOURS + " hours", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException(stage + " execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(stage + " interrupted", e);
        } finally {
            executor.shutdown();
        }

        if (!errors.isEmpty()) {
            RuntimeException first = errors.poll();
            log.error("[{}] {} of {} task(s) failed; first: {}", stage.toUpperCase(), errors.size() + 1,
                    items.size(), first.getMessage());
            errors.forEach(first::addSuppressed);
            throw first;
        }

        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> f : futures) {
            results.add(f.join());
        }
        return results;
    }
}
