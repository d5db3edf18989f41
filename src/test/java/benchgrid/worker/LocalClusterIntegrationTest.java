package benchgrid.worker;

import benchgrid.catalog.BuiltinTaskCatalog;
import benchgrid.catalog.TaskSets;
import benchgrid.catalog.TaskType;
import benchgrid.events.EventEmitter;
import benchgrid.events.EventKind;
import benchgrid.events.EventTarget;
import benchgrid.logger.config.LoggerConfig;
import benchgrid.logger.model.LogSummary;
import benchgrid.logger.server.LoggerServer;
import benchgrid.scheduler.config.SchedulerConfig;
import benchgrid.scheduler.server.SchedulerServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalClusterIntegrationTest {

    @TempDir
    Path tmp;

    private LoggerServer logger;
    private SchedulerServer scheduler;

    @BeforeEach
    void setUp() throws Exception {
        logger = LoggerServer.create(LoggerConfig.defaults().withHost("127.0.0.1").withPort(0).withOutputDir(tmp));
        logger.start();
        EventTarget events = new EventTarget("127.0.0.1", logger.boundPort());

        scheduler = SchedulerServer.create(SchedulerConfig.defaults()
                .withHost("127.0.0.1")
                .withPort(0)
                .withTasks(TaskSets.parse("matmul:4,primes:6,array:5,fileIO:5",
                        Map.of("matmul.size", 8, "primes.max_n", 1000, "array.array_size", 1000,
                                "fileIO.num_rw", 10, "fileIO.file_mb", 1)))
                .withShuffleSeed(7L)
                .withEventTarget(events)
                .withProgressInterval(Duration.ZERO));
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        logger.stop();
    }

    @Test
    @DisplayName("Local cluster: 4 workers drain 20 tasks and the logger sees every lifecycle")
    void clusterDrainsQueue() throws Exception {
        WorkerConfig base = WorkerConfig.defaults()
                .withScheduler("127.0.0.1", scheduler.boundPort())
                .withEventTarget(new EventTarget("127.0.0.1", logger.boundPort()));
        BuiltinTaskCatalog catalog = BuiltinTaskCatalog.create(tmp.resolve("io.bin"));

        List<WorkerReport> reports;
        try (EventEmitter events = EventEmitter.forTarget(base.eventTarget(), Duration.ofSeconds(1));
                LocalCluster cluster = new LocalCluster(base, catalog, events)) {
            cluster.start(4, "sim");
            assertEquals(List.of("sim-1", "sim-2", "sim-3", "sim-4"), cluster.nodeIds());
            reports = cluster.await(Duration.ofSeconds(60));
        }
        // closing the emitters flushes their backlog
        scheduler.stop();

        assertEquals(4, reports.size());
        assertEquals(20, reports.stream().mapToInt(WorkerReport::tasksCompleted).sum());
        assertTrue(scheduler.state().isComplete());
        assertEquals(4, scheduler.state().registeredNodes().size());

        LogSummary summary = logger.store().summary();
        assertEquals(20, summary.eventCount(EventKind.TASK_ASSIGNED));
        assertEquals(20, summary.eventCount(EventKind.TASK_REQUESTED));
        assertEquals(20, summary.eventCount(EventKind.TASK_FINISHED));
        assertEquals(20, summary.totalTasks());
        // scheduler and workers send from different connections, so a FINISHED
        // can overtake its ASSIGNED; each one still lands in exactly one bucket
        assertEquals(20, summary.completedTasks() + summary.orphanedFinishes());
        assertEquals(4, summary.taskTypes().get(TaskType.MATMUL.wireName()).total());
    }

    @Test
    @DisplayName("A failing worker is logged and the others carry on")
    void failingWorkerDoesNotStopOthers() throws Exception {
        WorkerConfig base = WorkerConfig.defaults().withScheduler("127.0.0.1", scheduler.boundPort());
        BuiltinTaskCatalog catalog = BuiltinTaskCatalog.create(tmp.resolve("io.bin"))
                .with(TaskType.FILEIO, params -> {
                    throw new IllegalStateException("disk on fire");
                });

        List<WorkerReport> reports;
        try (LocalCluster cluster = new LocalCluster(base, catalog, EventEmitter.NOOP)) {
            cluster.start(3, "w");
            reports = cluster.await(Duration.ofSeconds(60));
        }

        // every fileIO task kills the worker that drew it
        assertTrue(reports.size() < 3);
        assertFalse(scheduler.state().isComplete());
    }
}
