package benchgrid.logger.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals for the instances of one node or one task type.
 */
public record GroupStats(
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("pending") int pending,
        @JsonProperty("durations") DurationStats durations) {

    public static GroupStats of(List<TaskInstance> instances) {
        List<Double> durations = new ArrayList<>();
        for (TaskInstance t : instances) {
            if (t.isCompleted()) {
                durations.add(t.duration());
            }
        }
        return new GroupStats(instances.size(), durations.size(), instances.size() - durations.size(),
                DurationStats.of(durations));
    }
}
