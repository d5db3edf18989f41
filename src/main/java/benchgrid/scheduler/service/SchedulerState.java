package benchgrid.scheduler.service;

import benchgrid.catalog.TaskSpec;
import benchgrid.scheduler.config.PopOrder;
import benchgrid.scheduler.model.FinishResult;
import benchgrid.scheduler.model.FinishedTask;
import benchgrid.scheduler.model.NodeIdentity;
import benchgrid.scheduler.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The scheduler's shared state: waiting queue, per-node in-flight map, node
 * registry and finished list.
 *
 * One lock guards all of it, so popping a task and recording who holds it
 * are a single atomic step and no two requests can receive the same task.
 *
 * A node that disconnects after ASSIGN and never reports FINISH keeps its
 * task in flight for the rest of the run. Nothing times out or re-queues.
 */
public class SchedulerState {

    private static final Logger log = LoggerFactory.getLogger(SchedulerState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final PopOrder popOrder;
    private final String schedulerName;
    private final int total;

    private final ArrayList<TaskSpec> waiting;
    private final Map<String, TaskSpec> inFlight = new LinkedHashMap<>();
    private final Map<String, NodeIdentity> nodes = new LinkedHashMap<>();
    private final List<FinishedTask> finished = new ArrayList<>();
    private final List<TaskSpec> abandoned = new ArrayList<>();

    public SchedulerState(List<TaskSpec> tasks, PopOrder popOrder, String schedulerName) {
        this(tasks, popOrder, schedulerName, Clock.systemUTC());
    }

    SchedulerState(List<TaskSpec> tasks, PopOrder popOrder, String schedulerName, Clock clock) {
        this.waiting = new ArrayList<>(tasks);
        this.total = tasks.size();
        this.popOrder = popOrder;
        this.schedulerName = schedulerName;
        this.clock = clock;
        log.info("Task set ({} tasks, pop order {}): {}", total, popOrder, describe(tasks));
    }

    public String schedulerName() {
        return schedulerName;
    }

    public PopOrder popOrder() {
        return popOrder;
    }

    /**
     * Add a node to the registry. Registering twice is harmless.
     *
     * @return true if the node was not registered before
     */
    public boolean register(String nodeId) {
        requireNode(nodeId);
        lock.lock();
        try {
            if (nodes.containsKey(nodeId)) {
                log.info("Node re-registered: {}", nodeId);
                return false;
            }
            nodes.put(nodeId, new NodeIdentity(nodeId, clock.instant()));
            log.info("Node registered: {} ({} nodes)", nodeId, nodes.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand one waiting task to a node.
     *
     * @return the assigned task, or empty when the queue is exhausted (REST)
     */
    public Optional<TaskSpec> requestTask(String nodeId) {
        requireNode(nodeId);
        lock.lock();
        try {
            if (!nodes.containsKey(nodeId)) {
                nodes.put(nodeId, new NodeIdentity(nodeId, clock.instant()));
                log.info("Node {} requested a task without registering, registered implicitly", nodeId);
            }
            if (waiting.isEmpty()) {
                log.info("No more tasks available, sending REST to {}", nodeId);
                return Optional.empty();
            }

            TaskSpec task = popOrder == PopOrder.FIFO ? waiting.remove(0) : waiting.remove(waiting.size() - 1);
            TaskSpec previous = inFlight.put(nodeId, task);
            if (previous != null) {
                abandoned.add(previous);
                log.warn("Node {} requested a task before finishing '{}'; that task is abandoned",
                        nodeId, previous.type());
            }
            log.info("Assigned task '{}' to node {} ({} remaining)", task.type(), nodeId, waiting.size());
            return Optional.of(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that a node finished its in-flight task.
     */
    public FinishResult finish(String nodeId, double durationSeconds) {
        requireNode(nodeId);
        lock.lock();
        try {
            TaskSpec task = inFlight.remove(nodeId);
            if (task == null) {
                log.warn("Node {} sent FINISH but no task was assigned to it", nodeId);
                return FinishResult.UNMATCHED;
            }
            finished.add(new FinishedTask(task, nodeId, durationSeconds));
            log.info("Task '{}' completed by {} in {}s, progress {}/{}",
                    task.type(), nodeId, String.format("%.2f", durationSeconds), finished.size(), total);

            if (finished.size() == total) {
                log.info("All {} tasks completed", total);
                return FinishResult.RUN_COMPLETE;
            }
            return FinishResult.COMPLETED;
        } finally {
            lock.unlock();
        }
    }

    public SchedulerStatus status() {
        lock.lock();
        try {
            return new SchedulerStatus(schedulerName, total, waiting.size(), inFlight.size(),
                    finished.size(), abandoned.size(), nodes.size(), finished.size() == total);
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        lock.lock();
        try {
            return finished.size() == total;
        } finally {
            lock.unlock();
        }
    }

    public int totalTasks() {
        return total;
    }

    public List<TaskSpec> waitingTasks() {
        lock.lock();
        try {
            return List.copyOf(waiting);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, TaskSpec> inFlight() {
        lock.lock();
        try {
            return Map.copyOf(inFlight);
        } finally {
            lock.unlock();
        }
    }

    public List<NodeIdentity> registeredNodes() {
        lock.lock();
        try {
            return List.copyOf(nodes.values());
        } finally {
            lock.unlock();
        }
    }

    public List<FinishedTask> finishedTasks() {
        lock.lock();
        try {
            return List.copyOf(finished);
        } finally {
            lock.unlock();
        }
    }

    public List<TaskSpec> abandonedTasks() {
        lock.lock();
        try {
            return List.copyOf(abandoned);
        } finally {
            lock.unlock();
        }
    }

    private static void requireNode(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
    }

    private static String describe(List<TaskSpec> tasks) {
        List<String> names = new ArrayList<>(tasks.size());
        for (TaskSpec t : tasks) {
            names.add(t.type().wireName());
        }
        return names.toString();
    }
}
