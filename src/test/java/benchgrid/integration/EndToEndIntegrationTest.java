package benchgrid.integration;

import benchgrid.catalog.TaskSpec;
import benchgrid.catalog.TaskType;
import benchgrid.events.EventTarget;
import benchgrid.logger.config.LoggerConfig;
import benchgrid.logger.model.TaskInstance;
import benchgrid.logger.server.LoggerServer;
import benchgrid.net.LineClient;
import benchgrid.scheduler.config.PopOrder;
import benchgrid.scheduler.config.SchedulerConfig;
import benchgrid.scheduler.server.SchedulerServer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives one node by hand through a full run against real scheduler and
 * logger servers.
 */
class EndToEndIntegrationTest {

    @TempDir
    Path tmp;

    private SchedulerServer scheduler;
    private LoggerServer logger;

    @BeforeEach
    void setUp() throws Exception {
        logger = LoggerServer.create(LoggerConfig.defaults()
                .withHost("127.0.0.1")
                .withPort(0)
                .withOutputDir(tmp));
        logger.start();

        scheduler = SchedulerServer.create(SchedulerConfig.defaults()
                .withHost("127.0.0.1")
                .withPort(0)
                .withSchedulerName("S")
                .withTasks(List.of(TaskSpec.withDefaults(TaskType.MATMUL), TaskSpec.withDefaults(TaskType.PRIMES)))
                .withShuffle(false)
                .withPopOrder(PopOrder.FIFO)
                .withProgressInterval(Duration.ZERO));
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        logger.stop();
    }

    @Test
    @DisplayName("One node: register, two tasks, REST; logger computes the duration")
    void singleNodeRun() throws Exception {
        LineClient s = new LineClient("127.0.0.1", scheduler.boundPort(), Duration.ofSeconds(2), Duration.ofSeconds(5));
        LineClient l = new LineClient("127.0.0.1", logger.boundPort(), Duration.ofSeconds(2), Duration.ofSeconds(5));

        assertEquals("REGISTER|CONFIRM|true|S", s.exchange("REGISTER|REQUEST|W1"));

        String first = s.exchange("TASK|REQUEST|W1");
        assertTrue(first.startsWith("TASK|ASSIGN|matmul|"), first);
        assertTrue(first.contains("\"size\":425"), first);
        l.send("NODE W1 EVENT TASK_ASSIGNED TIME 100.0 TASK matmul");
        s.send("TASK|FINISH|2.5|W1");
        l.send("NODE W1 EVENT TASK_FINISHED TIME 102.5 TASK matmul");

        String second = s.exchange("TASK|REQUEST|W1");
        assertTrue(second.startsWith("TASK|ASSIGN|primes|"), second);
        s.send("TASK|FINISH|1.0|W1");

        assertEquals("TASK|ASSIGN|REST", s.exchange("TASK|REQUEST|W1"));
        assertTrue(scheduler.state().isComplete());
        assertEquals(2.5, scheduler.state().finishedTasks().get(0).durationSeconds());

        TaskInstance matmul = logger.store().instance("matmul_1").orElseThrow();
        assertEquals(2.5, matmul.duration(), 1e-9);
        assertEquals("W1", matmul.node());
    }

    @Test
    @DisplayName("Scheduler emits TASK_ASSIGNED to the configured logger")
    void schedulerEmitsAssignments() throws Exception {
        scheduler.stop();
        scheduler = SchedulerServer.create(SchedulerConfig.defaults()
                .withHost("127.0.0.1")
                .withPort(0)
                .withTasks(List.of(TaskSpec.of(TaskType.ARRAY, Map.of("array_size", 10))))
                .withEventTarget(new EventTarget("127.0.0.1", logger.boundPort()))
                .withProgressInterval(Duration.ZERO));
        scheduler.start();

        LineClient s = new LineClient("127.0.0.1", scheduler.boundPort(), Duration.ofSeconds(2), Duration.ofSeconds(5));
        s.exchange("TASK|REQUEST|W7");

        long deadline = System.currentTimeMillis() + 5000;
        while (logger.store().instance("array_1").isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals("W7", logger.store().instance("array_1").orElseThrow().node());
    }
}
