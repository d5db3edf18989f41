package benchgrid.cli;

import benchgrid.catalog.BuiltinTaskCatalog;
import benchgrid.catalog.TaskExecutionException;
import benchgrid.events.EventEmitter;
import benchgrid.events.EventTarget;
import benchgrid.logger.config.LoggerConfig;
import benchgrid.logger.server.LoggerServer;
import benchgrid.net.LineClient;
import benchgrid.net.LineProtocolServer;
import benchgrid.protocol.ProtocolException;
import benchgrid.scheduler.config.PopOrder;
import benchgrid.scheduler.config.SchedulerConfig;
import benchgrid.scheduler.model.SchedulerStatus;
import benchgrid.scheduler.server.SchedulerServer;
import benchgrid.util.Jsons;
import benchgrid.worker.LocalCluster;
import benchgrid.worker.NodeWorker;
import benchgrid.worker.SchedulerClient;
import benchgrid.worker.WorkerConfig;
import benchgrid.worker.WorkerReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;

@Command(
        name = "benchgrid",
        mixinStandardHelpOptions = true,
        version = "benchgrid 1.0.0",
        description = "Benchmark task scheduler, node worker and lifecycle logger",
        subcommands = {
                BenchGridCommand.SchedulerCommand.class,
                BenchGridCommand.WorkerCommand.class,
                BenchGridCommand.LoggerCommand.class,
                BenchGridCommand.LocalCommand.class,
                BenchGridCommand.StatusCommand.class,
                BenchGridCommand.QueryCommand.class
        })
public final class BenchGridCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BenchGridCommand.class);

    @Override
    public void run() {
        System.out.println("Use a subcommand: scheduler, worker, logger, local, status, query");
    }

    @Command(name = "scheduler", description = "Run the scheduler until interrupted")
    static final class SchedulerCommand implements Callable<Integer> {
        @Option(names = {"--bind"}, description = "Bind host (env BENCHGRID_SCHEDULER_HOST)")
        String bind;

        @Option(names = {"--port"}, description = "Bind port (env BENCHGRID_SCHEDULER_PORT)")
        Integer port;

        @Option(names = {"--tasks"}, description = "Task set, type:count,... (env BENCHGRID_TASKS)")
        String tasks;

        @Option(names = {"--param"}, description = "Parameter override, type.name=value (repeatable)")
        Map<String, Double> params;

        @Option(names = {"--pop-order"}, description = "LIFO or FIFO (env BENCHGRID_POP_ORDER)")
        PopOrder popOrder;

        @Option(names = {"--no-shuffle"}, defaultValue = "false", description = "Keep the task set in its given order")
        boolean noShuffle;

        @Option(names = {"--seed"}, description = "Shuffle seed")
        Long seed;

        @Option(names = {"--events"}, description = "Logger address host:port for TASK_ASSIGNED events (env BENCHGRID_EVENTS)")
        String events;

        @Option(names = {"--progress-seconds"}, defaultValue = "30", description = "Progress log interval; 0 disables")
        long progressSeconds;

        @Override
        public Integer call() throws Exception {
            SchedulerConfig config = schedulerConfig(bind, port, tasks, params, popOrder, noShuffle, seed, events)
                    .withProgressInterval(Duration.ofSeconds(progressSeconds));
            SchedulerServer server = SchedulerServer.create(config);
            server.start();
            awaitShutdown(server);
            return 0;
        }
    }

    @Command(name = "worker", description = "Register with a scheduler and run tasks until REST")
    static final class WorkerCommand implements Callable<Integer> {
        @Option(names = {"--scheduler"}, description = "Scheduler address host:port")
        String scheduler;

        @Option(names = {"--node-id"}, description = "Node identity (default: hostname, env BENCHGRID_NODE_ID)")
        String nodeId;

        @Option(names = {"--events"}, description = "Logger address host:port (env BENCHGRID_EVENTS)")
        String events;

        @Option(names = {"--io-file"}, description = "Scratch file for fileIO tasks (env BENCHGRID_IO_FILE_PATH)")
        Path ioFile;

        @Override
        public Integer call() {
            WorkerConfig config = workerConfig(scheduler, events, ioFile);
            if (nodeId != null) {
                config.withNodeId(nodeId);
            }
            log.info("Starting worker with config: {}", config);

            SchedulerClient client = new SchedulerClient(config.schedulerHost(), config.schedulerPort(),
                    config.connectTimeout(), config.readTimeout());
            try (EventEmitter emitter = EventEmitter.forTarget(config.eventTarget(), config.eventTimeout())) {
                NodeWorker worker = new NodeWorker(config.nodeId(), client,
                        BuiltinTaskCatalog.create(config.ioFilePath()), emitter);
                WorkerReport report = worker.run();
                log.info("Worker {} done: {} tasks, {}s busy", report.nodeId(), report.tasksCompleted(),
                        String.format("%.3f", report.busySeconds()));
                return 0;
            } catch (IOException e) {
                log.error("Cannot reach scheduler {}: {}", client, e.toString());
                return 2;
            } catch (ProtocolException e) {
                log.error("Protocol error talking to scheduler {}: {}", client, e.getMessage());
                return 3;
            } catch (TaskExecutionException e) {
                log.error("Task {} failed, worker stopping", e.taskType(), e);
                return 4;
            }
        }
    }

    @Command(name = "logger", description = "Run the lifecycle logger until interrupted, then export")
    static final class LoggerCommand implements Callable<Integer> {
        @Option(names = {"--bind"}, description = "Bind host (env BENCHGRID_LOGGER_HOST)")
        String bind;

        @Option(names = {"--port"}, description = "Bind port (env BENCHGRID_LOGGER_PORT)")
        Integer port;

        @Option(names = {"--out"}, description = "Export directory (env BENCHGRID_LOG_DIR)")
        Path out;

        @Option(names = {"--export-seconds"}, description = "Periodic export interval; 0 disables")
        Long exportSeconds;

        @Override
        public Integer call() throws Exception {
            LoggerConfig config = LoggerConfig.fromEnv();
            if (bind != null) {
                config.withHost(bind);
            }
            if (port != null) {
                config.withPort(port);
            }
            if (out != null) {
                config.withOutputDir(out);
            }
            if (exportSeconds != null) {
                config.withExportInterval(Duration.ofSeconds(exportSeconds));
            }
            LoggerServer server = LoggerServer.create(config);
            server.start();
            awaitShutdown(server);
            return 0;
        }
    }

    @Command(name = "local", description = "Run scheduler and N workers in one process")
    static final class LocalCommand implements Callable<Integer> {
        @Option(names = {"--workers"}, defaultValue = "3", description = "Number of workers")
        int workers;

        @Option(names = {"--tasks"}, description = "Task set, type:count,...")
        String tasks;

        @Option(names = {"--param"}, description = "Parameter override, type.name=value (repeatable)")
        Map<String, Double> params;

        @Option(names = {"--pop-order"}, description = "LIFO or FIFO")
        PopOrder popOrder;

        @Option(names = {"--events"}, description = "Logger address host:port")
        String events;

        @Option(names = {"--io-file"}, description = "Scratch file for fileIO tasks")
        Path ioFile;

        @Option(names = {"--timeout-minutes"}, defaultValue = "60", description = "Give up after this long")
        long timeoutMinutes;

        @Override
        public Integer call() throws Exception {
            SchedulerConfig config = schedulerConfig("127.0.0.1", 0, tasks, params, popOrder, false, null, events)
                    .withProgressInterval(Duration.ZERO);
            try (SchedulerServer server = SchedulerServer.create(config)) {
                server.start();
                WorkerConfig workerConfig = WorkerConfig.defaults()
                        .withScheduler("127.0.0.1", server.boundPort())
                        .withEventTarget(config.eventTarget())
                        .withIoFilePath(ioFile);

                try (EventEmitter emitter = EventEmitter.forTarget(workerConfig.eventTarget(), workerConfig.eventTimeout());
                        LocalCluster cluster = new LocalCluster(workerConfig,
                                BuiltinTaskCatalog.create(ioFile), emitter)) {
                    cluster.start(workers, "local");
                    List<WorkerReport> reports = cluster.await(Duration.ofMinutes(timeoutMinutes));
                    for (WorkerReport r : reports) {
                        log.info("{}: {} tasks, {}s busy", r.nodeId(), r.tasksCompleted(),
                                String.format("%.3f", r.busySeconds()));
                    }
                } catch (TimeoutException e) {
                    log.error("Local run did not finish within {} minutes", timeoutMinutes);
                    return 1;
                }
                SchedulerStatus status = server.state().status();
                System.out.println(Jsons.toJson(status));
                return status.complete() ? 0 : 1;
            }
        }
    }

    @Command(name = "status", description = "Print a scheduler's progress as JSON")
    static final class StatusCommand implements Callable<Integer> {
        @Option(names = {"--scheduler"}, description = "Scheduler address host:port")
        String scheduler;

        @Override
        public Integer call() throws Exception {
            WorkerConfig config = workerConfig(scheduler, null, null);
            SchedulerClient client = new SchedulerClient(config.schedulerHost(), config.schedulerPort(),
                    config.connectTimeout(), config.readTimeout());
            System.out.println(Jsons.toJson(client.status()));
            return 0;
        }
    }

    @Command(name = "query", description = "Query a running logger: SUMMARY, SNAPSHOT, INSTANCE <id>, NODE <n>, TYPE <t>")
    static final class QueryCommand implements Callable<Integer> {
        @Option(names = {"--logger"}, defaultValue = "127.0.0.1:5001", description = "Logger address host:port")
        String logger;

        @Parameters(arity = "1..2", description = "Query target and optional argument")
        List<String> query;

        @Override
        public Integer call() throws Exception {
            EventTarget target = EventTarget.parse(logger);
            LineClient client = new LineClient(target.host(), target.port(), Duration.ofSeconds(2), Duration.ofSeconds(10));
            String reply = client.exchange("QUERY " + String.join(" ", query));
            if (reply == null) {
                log.error("Logger {} rejected the query", target);
                return 1;
            }
            System.out.println(reply);
            return 0;
        }
    }

    static SchedulerConfig schedulerConfig(String bind, Integer port, String tasks, Map<String, Double> params,
            PopOrder popOrder, boolean noShuffle, Long seed, String events) {
        SchedulerConfig config = SchedulerConfig.fromEnv();
        if (bind != null) {
            config.withHost(bind);
        }
        if (port != null) {
            config.withPort(port);
        }
        if (tasks != null) {
            config.withTaskSet(tasks);
        }
        if (params != null) {
            config.withParameterOverrides(Map.copyOf(params));
        }
        if (popOrder != null) {
            config.withPopOrder(popOrder);
        }
        if (noShuffle) {
            config.withShuffle(false);
        }
        if (seed != null) {
            config.withShuffleSeed(seed);
        }
        if (events != null) {
            config.withEventTarget(EventTarget.parse(events));
        }
        return config;
    }

    static WorkerConfig workerConfig(String scheduler, String events, Path ioFile) {
        WorkerConfig config = WorkerConfig.fromEnv();
        if (scheduler != null) {
            EventTarget address = EventTarget.parse(scheduler);
            config.withScheduler(address.host(), address.port());
        }
        if (events != null) {
            config.withEventTarget(EventTarget.parse(events));
        }
        if (ioFile != null) {
            config.withIoFilePath(ioFile);
        }
        return config;
    }

    /**
     * Block until SIGINT/SIGTERM, then stop the server.
     */
    static void awaitShutdown(LineProtocolServer server) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            stopped.countDown();
        }, "benchgrid-shutdown"));
        stopped.await();
    }
}
