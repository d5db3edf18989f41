package benchgrid.support;

import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicJobsTest {

    @Test
    void runsJobRepeatedly() throws InterruptedException {
        CountDownLatch runs = new CountDownLatch(3);
        try (PeriodicJobs jobs = new PeriodicJobs("test-jobs")) {
            assertTrue(jobs.schedule("counter", Duration.ofMillis(20), runs::countDown));
            assertTrue(runs.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void zeroIntervalDisablesJob() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        try (PeriodicJobs jobs = new PeriodicJobs("test-jobs")) {
            assertFalse(jobs.schedule("never", Duration.ZERO, runs::incrementAndGet));
            assertFalse(jobs.schedule("never", null, runs::incrementAndGet));
            Thread.sleep(50);
        }
        assertEquals(0, runs.get());
    }

    @Test
    void failingRunDoesNotCancelLaterRuns() throws InterruptedException {
        // first run throws, later runs still happen
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch later = new CountDownLatch(2);
        try (PeriodicJobs jobs = new PeriodicJobs("test-jobs")) {
            jobs.schedule("flaky", Duration.ofMillis(20), () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("first run fails");
                }
                later.countDown();
            });
            assertTrue(later.await(2, TimeUnit.SECONDS));
        }
    }
}
