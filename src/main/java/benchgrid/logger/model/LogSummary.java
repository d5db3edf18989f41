package benchgrid.logger.model;

import benchgrid.events.EventKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view of a snapshot: event counts, per-node and per-type totals,
 * and duration statistics over completed instances.
 */
public record LogSummary(
        @JsonProperty("total_events") int totalEvents,
        @JsonProperty("total_tasks") int totalTasks,
        @JsonProperty("completed_tasks") int completedTasks,
        @JsonProperty("orphaned_finishes") int orphanedFinishes,
        @JsonProperty("event_counts") Map<String, Integer> eventCounts,
        @JsonProperty("durations") DurationStats durations,
        @JsonProperty("nodes") Map<String, GroupStats> nodes,
        @JsonProperty("task_types") Map<String, GroupStats> taskTypes) {

    public static LogSummary of(LogSnapshot snapshot) {
        Map<String, Integer> counts = new TreeMap<>();
        for (LifecycleEvent e : snapshot.events()) {
            counts.merge(e.kind().name(), 1, Integer::sum);
        }

        Map<String, List<TaskInstance>> byNode = new TreeMap<>();
        Map<String, List<TaskInstance>> byType = new TreeMap<>();
        List<Double> durations = new ArrayList<>();
        for (TaskInstance t : snapshot.tasks().values()) {
            byNode.computeIfAbsent(t.node(), k -> new ArrayList<>()).add(t);
            byType.computeIfAbsent(t.taskType(), k -> new ArrayList<>()).add(t);
            if (t.isCompleted()) {
                durations.add(t.duration());
            }
        }

        return new LogSummary(
                snapshot.events().size(),
                snapshot.tasks().size(),
                durations.size(),
                snapshot.orphanedFinishes(),
                counts,
                DurationStats.of(durations),
                group(byNode),
                group(byType));
    }

    public int eventCount(EventKind kind) {
        return eventCounts.getOrDefault(kind.name(), 0);
    }

    private static Map<String, GroupStats> group(Map<String, List<TaskInstance>> groups) {
        Map<String, GroupStats> out = new TreeMap<>();
        groups.forEach((key, list) -> out.put(key, GroupStats.of(list)));
        return out;
    }
}
