package com.vidnyan.rulecov.application.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on a fixed pool of at most {@code limit} threads.
 * Outcomes come back in submission order; a failing task does not cancel the others.
 */
@Slf4j
public final class BoundedExecutor {

    private BoundedExecutor() {
    }

    public static <T> List<TaskOutcome<T>> runAll(List<? extends Callable<T>> tasks, int limit, String threadPrefix) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(limit, tasks.size()));
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<T>> futures = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                futures.add(pool.submit(task));
            }
            List<TaskOutcome<T>> outcomes = new ArrayList<>(tasks.size());
            for (Future<T> future : futures) {
                outcomes.add(collect(future));
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    private static <T> TaskOutcome<T> collect(Future<T> future) {
        try {
            return TaskOutcome.success(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Task failed: {}", cause.getMessage());
            return TaskOutcome.failure(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TaskOutcome.failure(e);
        }
    }
}
