package benchgrid.logger.service;

import benchgrid.events.EventKind;
import benchgrid.logger.model.LifecycleEvent;
import benchgrid.logger.model.LogSnapshot;
import benchgrid.logger.model.LogSummary;
import benchgrid.logger.model.TaskInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Raw event log plus the task-instance table reconstructed from it.
 *
 * Senders never name an instance. An ASSIGNED event opens instance
 * {@code <type>_<n>} (n counts per type from 1, never reused). A FINISHED
 * event closes the most recently inserted unfinished instance of the same
 * type on the same node. That match is only right while a node never runs
 * two tasks of one type at the same time.
 *
 * Ordering is this store's insertion order, not event time. Reads copy the
 * state under the lock and aggregate outside it.
 */
public class TimelineStore {

    private static final Logger log = LoggerFactory.getLogger(TimelineStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<LifecycleEvent> events = new ArrayList<>();
    private final Map<String, TaskInstance> instances = new HashMap<>();
    private final List<String> insertionOrder = new ArrayList<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private int orphanedFinishes = 0;

    /**
     * Append an event and update the instance table.
     *
     * @return the stored event, carrying its instance id when correlated
     */
    public LifecycleEvent record(LifecycleEvent event) {
        lock.lock();
        try {
            LifecycleEvent stored = correlate(event);
            events.add(stored);
            return stored;
        } finally {
            lock.unlock();
        }
    }

    private LifecycleEvent correlate(LifecycleEvent event) {
        String taskName = event.taskName();
        if (taskName == null) {
            if (event.kind() != EventKind.TASK_REQUESTED) {
                log.warn("{} from {} has no TASK, kept in the raw log only", event.kind(), event.node());
            }
            return event;
        }

        switch (event.kind()) {
            case TASK_ASSIGNED -> {
                int n = counters.merge(taskName, 1, Integer::sum);
                String id = taskName + "_" + n;
                LifecycleEvent stored = event.withInstance(id);
                instances.put(id, TaskInstance.assigned(id, stored));
                insertionOrder.add(id);
                return stored;
            }
            case TASK_FINISHED -> {
                Optional<String> match = latestOpen(taskName, event.node());
                if (match.isEmpty()) {
                    orphanedFinishes++;
                    log.warn("Orphaned TASK_FINISHED: no open {} instance on node {}", taskName, event.node());
                    return event;
                }
                String id = match.get();
                LifecycleEvent stored = event.withInstance(id);
                instances.put(id, instances.get(id).finish(stored));
                return stored;
            }
            default -> {
                return event;
            }
        }
    }

    private Optional<String> latestOpen(String taskType, String node) {
        ListIterator<String> it = insertionOrder.listIterator(insertionOrder.size());
        while (it.hasPrevious()) {
            String id = it.previous();
            TaskInstance t = instances.get(id);
            if (taskType.equals(t.taskType()) && node.equals(t.node()) && !t.isFinished()) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    public Optional<TaskInstance> instance(String instanceId) {
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(instanceId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Instances matching a filter, in insertion order.
     */
    public Map<String, TaskInstance> instancesWhere(Predicate<TaskInstance> filter) {
        Map<String, TaskInstance> out = new LinkedHashMap<>();
        for (TaskInstance t : snapshot().tasks().values()) {
            if (filter.test(t)) {
                out.put(t.instanceId(), t);
            }
        }
        return out;
    }

    public LogSnapshot snapshot() {
        lock.lock();
        try {
            Map<String, TaskInstance> ordered = new LinkedHashMap<>();
            for (String id : insertionOrder) {
                ordered.put(id, instances.get(id));
            }
            return new LogSnapshot(events, ordered, orphanedFinishes);
        } finally {
            lock.unlock();
        }
    }

    public LogSummary summary() {
        return LogSummary.of(snapshot());
    }

    public int eventCount() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }
}
