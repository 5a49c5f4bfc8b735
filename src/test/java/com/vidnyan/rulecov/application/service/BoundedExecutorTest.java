package com.vidnyan.rulecov.application.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedExecutorTest {

    @Test
    void runAll_ShouldReturnOutcomesInSubmissionOrder() {
        // Arrange: later tasks finish first
        List<Callable<Integer>> tasks = IntStream.range(0, 5)
                .<Callable<Integer>>mapToObj(i -> () -> {
                    Thread.sleep(50L - i * 10L);
                    return i;
                })
                .toList();

        // Act
        List<TaskOutcome<Integer>> outcomes = BoundedExecutor.runAll(tasks, 5, "test");

        // Assert
        assertEquals(List.of(0, 1, 2, 3, 4), outcomes.stream().map(TaskOutcome::value).toList());
    }

    @Test
    void runAll_ShouldIsolateFailingTask() {
        List<Callable<String>> tasks = List.of(
                () -> "first",
                () -> {
                    throw new IllegalStateException("broken");
                },
                () -> "third");

        List<TaskOutcome<String>> outcomes = BoundedExecutor.runAll(tasks, 2, "test");

        assertTrue(outcomes.get(0).succeeded());
        assertFalse(outcomes.get(1).succeeded());
        assertEquals("broken", outcomes.get(1).errorMessage());
        assertInstanceOf(IllegalStateException.class, outcomes.get(1).error());
        assertEquals("third", outcomes.get(2).value());
    }

    @Test
    void runAll_ShouldNeverExceedLimit() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Callable<Integer>> tasks = IntStream.range(0, 8)
                .<Callable<Integer>>mapToObj(i -> () -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(20);
                    running.decrementAndGet();
                    return i;
                })
                .toList();

        BoundedExecutor.runAll(tasks, 2, "test");

        assertTrue(peak.get() <= 2, "peak was " + peak.get());
    }

    @Test
    void runAll_ShouldRunTasksInParallelUpToLimit() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Callable<Boolean> task = () -> {
            bothStarted.countDown();
            return bothStarted.await(5, TimeUnit.SECONDS);
        };

        List<TaskOutcome<Boolean>> outcomes = BoundedExecutor.runAll(List.of(task, task), 2, "test");

        assertTrue(outcomes.stream().allMatch(outcome -> Boolean.TRUE.equals(outcome.value())));
    }

    @Test
    void runAll_ShouldTreatNonPositiveLimitAsOne() {
        List<TaskOutcome<String>> outcomes = BoundedExecutor.runAll(
                List.<Callable<String>>of(() -> Thread.currentThread().getName()), 0, "solo");

        assertEquals("solo-1", outcomes.get(0).value());
    }

    @Test
    void runAll_ShouldReturnEmptyListForNoTasks() {
        assertTrue(BoundedExecutor.runAll(List.<Callable<String>>of(), 4, "test").isEmpty());
    }
}
