package benchgrid.events;

import java.time.Duration;

/**
 * Best-effort sink for lifecycle events. Implementations never block the
 * caller for long and never throw: delivery failure does not affect the
 * sender's primary operation.
 */
public interface EventEmitter extends AutoCloseable {

    EventEmitter NOOP = new EventEmitter() {
        @Override
        public void emit(String node, EventKind kind, String taskName) {
        }

        @Override
        public void close() {
        }
    };

    /**
     * Emitter for the given logger, or {@link #NOOP} when none is configured.
     */
    static EventEmitter forTarget(EventTarget target, Duration timeout) {
        return target == null ? NOOP : new SocketEventEmitter(target, timeout);
    }

    /**
     * Send an event stamped with the current time.
     *
     * @param taskName task type wire name, null for TASK_REQUESTED
     */
    void emit(String node, EventKind kind, String taskName);

    @Override
    void close();
}
