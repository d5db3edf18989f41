package benchgrid.scheduler.config;

import benchgrid.catalog.TaskSpec;
import benchgrid.catalog.TaskSets;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals("0.0.0.0", config.host());
        assertEquals(5000, config.port());
        assertEquals(PopOrder.LIFO, config.popOrder());
        assertNull(config.eventTarget());
        assertEquals(Duration.ofSeconds(30), config.progressInterval());
        assertFalse(config.schedulerName().isBlank());
        assertEquals(13, config.seedTasks().size());
    }

    @Test
    void seededShuffleIsRepeatable() {
        List<TaskSpec> a = SchedulerConfig.defaults().withShuffleSeed(11L).seedTasks();
        List<TaskSpec> b = SchedulerConfig.defaults().withShuffleSeed(11L).seedTasks();

        assertEquals(a, b);
    }

    @Test
    void noShuffleKeepsGivenOrder() {
        List<TaskSpec> tasks = TaskSets.parse("matmul,primes,array", Map.of());

        assertEquals(tasks, SchedulerConfig.defaults().withTasks(tasks).withShuffle(false).seedTasks());
    }
}
