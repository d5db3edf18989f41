package benchgrid.logger.service;

import benchgrid.events.EventKind;
import benchgrid.logger.model.LifecycleEvent;
import benchgrid.logger.model.LogSummary;
import benchgrid.logger.model.TaskInstance;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TimelineStoreTest {

    private TimelineStore store;

    @BeforeEach
    void setup() {
        store = new TimelineStore();
    }

    @Test
    void assignedThenFinishedGivesDuration() {
        LifecycleEvent assigned = store.record(event("w1", EventKind.TASK_ASSIGNED, 100.0, "matmul"));
        LifecycleEvent finished = store.record(event("w1", EventKind.TASK_FINISHED, 102.5, "matmul"));

        assertEquals("matmul_1", assigned.taskInstance());
        assertEquals("matmul_1", finished.taskInstance());

        TaskInstance t = store.instance("matmul_1").orElseThrow();
        assertEquals(2.5, t.duration(), 1e-9);
        assertEquals("w1", t.node());
        assertEquals(2, t.events().size());
    }

    @Test
    void instanceIdsCountPerType() {
        store.record(event("w1", EventKind.TASK_ASSIGNED, 1, "matmul"));
        store.record(event("w2", EventKind.TASK_ASSIGNED, 2, "primes"));
        store.record(event("w2", EventKind.TASK_ASSIGNED, 3, "matmul"));

        assertEquals(List.of("matmul_1", "primes_1", "matmul_2"),
                List.copyOf(store.snapshot().tasks().keySet()));
    }

    @Test
    void finishWithoutAssignmentIsOrphaned() {
        LifecycleEvent e = store.record(event("w1", EventKind.TASK_FINISHED, 5, "primes"));

        assertNull(e.taskInstance());
        assertTrue(store.snapshot().tasks().isEmpty());
        assertEquals(1, store.snapshot().orphanedFinishes());
        assertEquals(1, store.eventCount());
    }

    @Test
    void finishMatchesOnlySameNode() {
        store.record(event("w1", EventKind.TASK_ASSIGNED, 1, "matmul"));
        store.record(event("w2", EventKind.TASK_FINISHED, 2, "matmul"));

        assertFalse(store.instance("matmul_1").orElseThrow().isFinished());
        assertEquals(1, store.summary().orphanedFinishes());
    }

    @Test
    void finishClosesMostRecentOpenInstance() {
        store.record(event("w1", EventKind.TASK_ASSIGNED, 1, "array"));
        store.record(event("w1", EventKind.TASK_ASSIGNED, 2, "array"));
        store.record(event("w1", EventKind.TASK_FINISHED, 5, "array"));

        assertFalse(store.instance("array_1").orElseThrow().isFinished());
        assertEquals(3.0, store.instance("array_2").orElseThrow().duration(), 1e-9);

        // next finish falls back to the older one
        store.record(event("w1", EventKind.TASK_FINISHED, 6, "array"));
        assertEquals(5.0, store.instance("array_1").orElseThrow().duration(), 1e-9);
    }

    @Test
    void eventsWithoutTaskStayInRawLog() {
        store.record(event("w1", EventKind.TASK_REQUESTED, 1, null));
        store.record(event("w1", EventKind.TASK_ASSIGNED, 2, null));

        assertEquals(2, store.eventCount());
        assertTrue(store.snapshot().tasks().isEmpty());
    }

    @Test
    void summaryAggregatesByNodeAndType() {
        store.record(event("w1", EventKind.TASK_REQUESTED, 0, null));
        store.record(event("w1", EventKind.TASK_ASSIGNED, 10, "matmul"));
        store.record(event("w1", EventKind.TASK_FINISHED, 12, "matmul"));
        store.record(event("w2", EventKind.TASK_ASSIGNED, 10, "primes"));
        store.record(event("w2", EventKind.TASK_FINISHED, 14, "primes"));
        store.record(event("w2", EventKind.TASK_ASSIGNED, 20, "primes"));

        LogSummary s = store.summary();

        assertEquals(6, s.totalEvents());
        assertEquals(3, s.totalTasks());
        assertEquals(2, s.completedTasks());
        assertEquals(3, s.eventCount(EventKind.TASK_ASSIGNED));
        assertEquals(1, s.eventCount(EventKind.TASK_REQUESTED));
        assertEquals(3.0, s.durations().mean(), 1e-9);
        assertEquals(2.0, s.durations().min(), 1e-9);
        assertEquals(4.0, s.durations().max(), 1e-9);
        assertEquals(1, s.nodes().get("w2").pending());
        assertEquals(2, s.taskTypes().get("primes").total());
    }

    @Test
    void instancesWhereFilters() {
        store.record(event("w1", EventKind.TASK_ASSIGNED, 1, "matmul"));
        store.record(event("w2", EventKind.TASK_ASSIGNED, 1, "primes"));

        Map<String, TaskInstance> onW2 = store.instancesWhere(t -> "w2".equals(t.node()));

        assertEquals(List.of("primes_1"), List.copyOf(onW2.keySet()));
    }

    @Test
    void concurrentAssignmentsGetDistinctIds() throws Exception {
        int nodes = 32;
        ExecutorService pool = Executors.newFixedThreadPool(nodes);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<String>> ids = new ArrayList<>();
        try {
            for (int i = 0; i < nodes; i++) {
                String node = "n" + i;
                ids.add(pool.submit(() -> {
                    go.await();
                    String id = store.record(event(node, EventKind.TASK_ASSIGNED, 1, "matmul")).taskInstance();
                    store.record(event(node, EventKind.TASK_FINISHED, 2, "matmul"));
                    return id;
                }));
            }
            go.countDown();

            Set<String> seen = new HashSet<>();
            for (Future<String> f : ids) {
                assertTrue(seen.add(f.get(10, TimeUnit.SECONDS)), "duplicate instance id");
            }
            Set<String> expected = new HashSet<>();
            for (int i = 1; i <= nodes; i++) {
                expected.add("matmul_" + i);
            }
            assertEquals(expected, seen);
        } finally {
            pool.shutdownNow();
        }

        LogSummary s = store.summary();
        assertEquals(nodes, s.totalTasks());
        assertEquals(nodes, s.completedTasks());
        assertEquals(0, s.orphanedFinishes());
        assertEquals(2 * nodes, store.eventCount());
        store.snapshot().tasks().values().forEach(t -> assertTrue(t.isCompleted(), t.instanceId()));
    }

    private static LifecycleEvent event(String node, EventKind kind, double time, String task) {
        return LifecycleEvent.of(node, kind, time, task);
    }
}
