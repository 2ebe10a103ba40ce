package com.di.snapdiff.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelTasks Tests")
class ParallelTasksTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should return results in input order")
    void testKeepsOrder() {
        List<Integer> items = IntStream.range(0, 50).boxed().toList();
        List<Integer> squares = ParallelTasks.map("square", 4, items, i -> i * i);
        assertEquals(items.stream().map(i -> i * i).toList(), squares);
    }

    @Test
    @DisplayName("Should return an empty list for no items")
    void testEmpty() {
        assertTrue(ParallelTasks.map("none", 4, List.<String>of(), String::length).isEmpty());
    }

    @Test
    @DisplayName("Should reject a worker count below one")
    void testRejectsZeroWorkers() {
        assertThrows(IllegalArgumentException.class,
                () -> ParallelTasks.map("zero", 0, List.of("a"), String::length));
    }

    @Test
    @DisplayName("Should run every item and raise all failures together")
    void testAggregatesFailures() {
        AtomicInteger ran = new AtomicInteger();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> ParallelTasks.map("fail", 3,
                List.of(1, 2, 3, 4, 5), i -> {
                    ran.incrementAndGet();
                    if (i % 2 == 0) {
                        throw new IllegalArgumentException("bad " + i);
                    }
                    return i;
                }));
        assertEquals(5, ran.get());
        assertInstanceOf(IllegalArgumentException.class, ex);
        assertEquals(1, ex.getSuppressed().length);
    }

    @Test
    @DisplayName("Should propagate the caller's MDC to workers")
    void testMdcPropagation() {
        MDC.put("runId", "run-42");
        List<String> seen = ParallelTasks.map("mdc", 2, List.of("a", "b", "c"), s -> MDC.get("runId"));
        assertEquals(List.of("run-42", "run-42", "run-42"), seen);
    }
}
