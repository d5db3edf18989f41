package benchgrid.events;

import java.util.Optional;

/**
 * Lifecycle event kinds reported to the logger.
 */
public enum EventKind {
    /** Node received a task and is about to run it */
    TASK_REQUESTED,
    /** Scheduler handed a task to a node */
    TASK_ASSIGNED,
    /** Node finished running a task */
    TASK_FINISHED;

    public static Optional<EventKind> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EventKind kind : values()) {
            if (kind.name().equals(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
