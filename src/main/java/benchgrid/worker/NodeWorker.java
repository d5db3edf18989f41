package benchgrid.worker;

import benchgrid.catalog.TaskCatalog;
import benchgrid.catalog.TaskExecutionException;
import benchgrid.catalog.TaskSpec;
import benchgrid.events.EventEmitter;
import benchgrid.events.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * A single node worker.
 * Registers, then loops: request -> execute -> finish, until the scheduler
 * answers REST.
 *
 * A network error or a failing task ends the run; nothing is retried and a
 * task, once started, always runs to completion.
 */
public final class NodeWorker {

    private static final Logger log = LoggerFactory.getLogger(NodeWorker.class);

    private final String nodeId;
    private final SchedulerClient scheduler;
    private final TaskCatalog catalog;
    private final EventEmitter events;

    public NodeWorker(String nodeId, SchedulerClient scheduler, TaskCatalog catalog, EventEmitter events) {
        this.nodeId = nodeId;
        this.scheduler = scheduler;
        this.catalog = catalog;
        this.events = events;
    }

    public String nodeId() {
        return nodeId;
    }

    /**
     * Run until REST.
     *
     * @throws IOException            if the scheduler cannot be reached
     * @throws TaskExecutionException if a task body fails
     * @throws benchgrid.protocol.ProtocolException if registration is refused
     *                                or a reply cannot be understood
     */
    public WorkerReport run() throws IOException, TaskExecutionException {
        String schedulerName = scheduler.register(nodeId);
        log.info("Node {} registered with scheduler {} ({})", nodeId, scheduler, schedulerName);

        int completed = 0;
        double busy = 0;

        while (true) {
            Optional<TaskSpec> assigned = scheduler.requestTask(nodeId);
            if (assigned.isEmpty()) {
                log.info("Node {} received REST after {} tasks", nodeId, completed);
                break;
            }

            TaskSpec task = assigned.get();
            String taskName = task.type().wireName();
            events.emit(nodeId, EventKind.TASK_REQUESTED, null);
            log.debug("Node {} running {} {}", nodeId, taskName, task.parameters());

            long start = System.nanoTime();
            catalog.execute(taskName, task.parameters());
            double duration = (System.nanoTime() - start) / 1_000_000_000.0;

            scheduler.finish(nodeId, duration);
            events.emit(nodeId, EventKind.TASK_FINISHED, taskName);

            completed++;
            busy += duration;
            log.info("Node {} finished {} in {}s", nodeId, taskName, String.format("%.3f", duration));
        }

        return new WorkerReport(nodeId, completed, busy);
    }
}
