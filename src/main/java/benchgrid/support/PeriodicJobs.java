package benchgrid.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs named background jobs at a fixed rate on one daemon thread.
 * A failing run is logged and does not cancel later runs.
 */
public class PeriodicJobs implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicJobs.class);

    private final ScheduledExecutorService executor;

    public PeriodicJobs(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a job. A zero or negative interval disables it.
     *
     * @return true if the job was scheduled
     */
    public boolean schedule(String name, Duration interval, Runnable job) {
        long intervalMs = interval == null ? 0 : interval.toMillis();
        if (intervalMs <= 0) {
            log.debug("{} disabled", name);
            return false;
        }
        executor.scheduleAtFixedRate(wrapRunnable(name, job), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
        return true;
    }

    /**
     * Stop all jobs, waiting briefly for a running one to finish.
     */
    public void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Periodic jobs forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
