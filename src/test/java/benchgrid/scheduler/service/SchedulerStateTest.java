package benchgrid.scheduler.service;

import benchgrid.catalog.TaskSpec;
import benchgrid.catalog.TaskType;
import benchgrid.scheduler.config.PopOrder;
import benchgrid.scheduler.model.FinishResult;
import benchgrid.scheduler.model.SchedulerStatus;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerStateTest {

    private static final TaskSpec MATMUL = TaskSpec.of(TaskType.MATMUL, Map.of("size", 4));
    private static final TaskSpec PRIMES = TaskSpec.of(TaskType.PRIMES, Map.of("max_n", 10));
    private static final TaskSpec ARRAY = TaskSpec.of(TaskType.ARRAY, Map.of("array_size", 10));

    @Test
    void fifoPopsFromHead() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES, ARRAY), PopOrder.FIFO, "s");

        assertEquals(MATMUL, state.requestTask("a").orElseThrow());
        assertEquals(PRIMES, state.requestTask("b").orElseThrow());
    }

    @Test
    void lifoPopsFromTail() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES, ARRAY), PopOrder.LIFO, "s");

        assertEquals(ARRAY, state.requestTask("a").orElseThrow());
        assertEquals(PRIMES, state.requestTask("b").orElseThrow());
    }

    @Test
    void exhaustedQueueAnswersRest() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES), PopOrder.FIFO, "s");

        for (int i = 0; i < 2; i++) {
            assertTrue(state.requestTask("n" + i).isPresent());
        }
        // every later request is REST, for any node
        assertTrue(state.requestTask("n0").isEmpty());
        assertTrue(state.requestTask("other").isEmpty());
        assertEquals(0, state.waitingTasks().size());
    }

    @Test
    void emptyTaskSetRestsImmediately() {
        SchedulerState state = new SchedulerState(List.of(), PopOrder.LIFO, "s");

        assertTrue(state.requestTask("a").isEmpty());
        assertTrue(state.isComplete());
    }

    @Test
    void registrationIsIdempotent() {
        SchedulerState state = new SchedulerState(List.of(MATMUL), PopOrder.FIFO, "s");

        assertTrue(state.register("a"));
        assertFalse(state.register("a"));
        assertEquals(1, state.registeredNodes().size());
    }

    @Test
    void requestRegistersImplicitly() {
        SchedulerState state = new SchedulerState(List.of(MATMUL), PopOrder.FIFO, "s");

        state.requestTask("stranger");

        assertEquals("stranger", state.registeredNodes().get(0).id());
    }

    @Test
    void blankNodeIsRejected() {
        SchedulerState state = new SchedulerState(List.of(MATMUL), PopOrder.FIFO, "s");

        assertThrows(IllegalArgumentException.class, () -> state.register(" "));
        assertThrows(IllegalArgumentException.class, () -> state.requestTask(null));
    }

    @Test
    void finishCompletesInFlightTask() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES), PopOrder.FIFO, "s");
        state.requestTask("a");

        assertEquals(FinishResult.COMPLETED, state.finish("a", 1.5));
        assertTrue(state.inFlight().isEmpty());
        assertEquals(1, state.finishedTasks().size());
        assertEquals(MATMUL, state.finishedTasks().get(0).task());
        assertEquals(1.5, state.finishedTasks().get(0).durationSeconds());
    }

    @Test
    void finishWithoutAssignmentIsUnmatched() {
        SchedulerState state = new SchedulerState(List.of(MATMUL), PopOrder.FIFO, "s");

        assertEquals(FinishResult.UNMATCHED, state.finish("a", 1.0));
        assertTrue(state.finishedTasks().isEmpty());

        // finishing twice is also unmatched
        state.requestTask("a");
        state.finish("a", 1.0);
        assertEquals(FinishResult.UNMATCHED, state.finish("a", 1.0));
    }

    @Test
    void lastFinishCompletesRun() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES), PopOrder.FIFO, "s");
        state.requestTask("a");
        state.requestTask("b");

        assertEquals(FinishResult.COMPLETED, state.finish("a", 1.0));
        assertFalse(state.isComplete());
        assertEquals(FinishResult.RUN_COMPLETE, state.finish("b", 1.0));
        assertTrue(state.isComplete());
    }

    @Test
    void secondRequestAbandonsPreviousTask() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES, ARRAY), PopOrder.FIFO, "s");
        state.requestTask("a");

        TaskSpec second = state.requestTask("a").orElseThrow();

        assertEquals(PRIMES, second);
        assertEquals(List.of(MATMUL), state.abandonedTasks());
        assertEquals(Map.of("a", PRIMES), state.inFlight());
    }

    @Test
    void statusReflectsCounts() {
        SchedulerState state = new SchedulerState(List.of(MATMUL, PRIMES, ARRAY), PopOrder.FIFO, "sched");
        state.register("a");
        state.requestTask("a");
        state.finish("a", 2.0);
        state.requestTask("b");

        SchedulerStatus s = state.status();

        assertEquals("sched", s.scheduler());
        assertEquals(3, s.total());
        assertEquals(1, s.waiting());
        assertEquals(1, s.inFlight());
        assertEquals(1, s.finished());
        assertEquals(2, s.nodes());
        assertFalse(s.complete());
    }

    @Test
    void concurrentRequestsNeverShareATask() throws Exception {
        List<TaskSpec> seeded = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            seeded.add(TaskSpec.of(TaskType.PRIMES, Map.of("max_n", i)));
        }
        SchedulerState state = new SchedulerState(seeded, PopOrder.LIFO, "s");

        int nodes = 16;
        List<TaskSpec> handed = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(nodes);
        for (int n = 0; n < nodes; n++) {
            String node = "node-" + n;
            pool.submit(() -> {
                go.await();
                while (true) {
                    Optional<TaskSpec> t = state.requestTask(node);
                    if (t.isEmpty()) {
                        return null;
                    }
                    handed.add(t.get());
                    state.finish(node, 0.0);
                }
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        // handed out exactly the seeded multiset
        assertEquals(counts(seeded), counts(handed));
        assertTrue(state.isComplete());
        assertTrue(state.abandonedTasks().isEmpty());
    }

    private static Map<TaskSpec, Integer> counts(List<TaskSpec> tasks) {
        Map<TaskSpec, Integer> out = new HashMap<>();
        for (TaskSpec t : tasks) {
            out.merge(t, 1, Integer::sum);
        }
        return out;
    }
}
