package benchgrid.worker;

import benchgrid.catalog.TaskCatalog;
import benchgrid.events.EventEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs N node workers in-process against one scheduler.
 * Call start() to spawn them, await() to collect their reports.
 */
public final class LocalCluster implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalCluster.class);

    private final WorkerConfig baseConfig;
    private final TaskCatalog catalog;
    private final EventEmitter events;

    private ExecutorService executor;
    private final List<Future<WorkerReport>> futures = new ArrayList<>();
    private final List<String> nodeIds = new ArrayList<>();

    public LocalCluster(WorkerConfig baseConfig, TaskCatalog catalog, EventEmitter events) {
        this.baseConfig = baseConfig;
        this.catalog = catalog;
        this.events = events;
    }

    /**
     * Start workers named {@code <prefix>-1 .. <prefix>-N}.
     */
    public synchronized void start(int workers, String prefix) {
        if (executor != null) {
            log.warn("Local cluster already running");
            return;
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }

        executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        for (int i = 1; i <= workers; i++) {
            String nodeId = prefix + "-" + i;
            WorkerConfig config = baseConfig.copy().withNodeId(nodeId);
            SchedulerClient client = new SchedulerClient(config.schedulerHost(), config.schedulerPort(),
                    config.connectTimeout(), config.readTimeout());
            NodeWorker worker = new NodeWorker(nodeId, client, catalog, events);
            nodeIds.add(nodeId);
            futures.add(executor.submit(() -> {
                Thread.currentThread().setName("worker-" + nodeId);
                return worker.run();
            }));
        }

        log.info("Local cluster started: {} workers against {}:{}",
                workers, baseConfig.schedulerHost(), baseConfig.schedulerPort());
    }

    /**
     * Wait for every worker to stop.
     *
     * @return reports of the workers that ended cleanly; failures are logged
     * @throws TimeoutException if a worker is still running at the deadline
     */
    public List<WorkerReport> await(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<WorkerReport> reports = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            long remaining = deadline - System.nanoTime();
            try {
                reports.add(futures.get(i).get(Math.max(0, remaining), TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                log.error("Worker {} aborted: {}", nodeIds.get(i), e.getCause().toString());
            }
        }
        return reports;
    }

    public List<String> nodeIds() {
        return List.copyOf(nodeIds);
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Local cluster stopped");
    }
}
