package com.gamepanel.scheduler;

import com.gamepanel.scheduler.model.RunTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunStateRegistry Tests")
class RunStateRegistryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T04:00:00Z");

    private RunStateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RunStateRegistry();
    }

    @Test
    @DisplayName("A second acquire of the same schedule is refused until the first completes")
    void refusesOverlappingRun() {
        Optional<RunState> first = registry.tryAcquire("sched-1", RunTrigger.TIMER, NOW);
        Optional<RunState> second = registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertTrue(registry.isRunning("sched-1"));

        registry.complete(first.get(), RunStatus.SUCCESS);

        assertFalse(registry.isRunning("sched-1"));
        assertTrue(registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW).isPresent());
    }

    @Test
    @DisplayName("Different schedules run independently")
    void independentSchedules() {
        assertTrue(registry.tryAcquire("sched-1", RunTrigger.TIMER, NOW).isPresent());
        assertTrue(registry.tryAcquire("sched-2", RunTrigger.TIMER, NOW).isPresent());

        assertEquals(2, registry.runningCount());
        assertTrue(registry.isRunning("sched-2"));
    }

    @Test
    @DisplayName("Completing records the last result; releasing does not")
    void recordsLastResult() {
        RunState run = registry.tryAcquire("sched-1", RunTrigger.TIMER, NOW).orElseThrow();
        registry.complete(run, RunStatus.FAILED);
        assertEquals(Optional.of(RunStatus.FAILED), registry.lastResult("sched-1"));

        RunState retry = registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW).orElseThrow();
        registry.release(retry);
        assertEquals(Optional.of(RunStatus.FAILED), registry.lastResult("sched-1"));
        assertFalse(registry.isRunning("sched-1"));

        registry.forget("sched-1");
        assertTrue(registry.lastResult("sched-1").isEmpty());
    }

    @Test
    @DisplayName("A stale handle cannot end a newer run")
    void staleHandleIgnored() {
        RunState first = registry.tryAcquire("sched-1", RunTrigger.TIMER, NOW).orElseThrow();
        registry.complete(first, RunStatus.SUCCESS);
        RunState second = registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW).orElseThrow();

        registry.release(first);

        assertTrue(registry.isRunning("sched-1"));
        assertSame(second, registry.find("sched-1").orElseThrow());
    }

    @Test
    @DisplayName("The executing index is visible through the registry")
    void exposesExecutingIndex() {
        RunState run = registry.tryAcquire("sched-1", RunTrigger.TIMER, NOW).orElseThrow();
        assertNull(registry.executingTaskIndex("sched-1"));

        run.setExecutingTaskIndex(2);

        assertEquals(2, registry.executingTaskIndex("sched-1"));
        assertNull(registry.executingTaskIndex("unknown"));
    }

    @Test
    @DisplayName("Concurrent acquires of one schedule let exactly one through")
    void concurrentAcquire() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<RunState>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return registry.tryAcquire("sched-1", RunTrigger.MANUAL, NOW);
                }));
            }
            go.countDown();

            int acquired = 0;
            for (Future<Optional<RunState>> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).isPresent()) {
                    acquired++;
                }
            }
            assertEquals(1, acquired);
        } finally {
            pool.shutdownNow();
        }
    }
}
