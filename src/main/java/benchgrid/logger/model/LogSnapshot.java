package benchgrid.logger.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consistent copy of the logger state: raw event log plus instances in
 * insertion order.
 */
public record LogSnapshot(List<LifecycleEvent> events, Map<String, TaskInstance> tasks, int orphanedFinishes) {

    public LogSnapshot {
        events = List.copyOf(events);
        tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }
}
