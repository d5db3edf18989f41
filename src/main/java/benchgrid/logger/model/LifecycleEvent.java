package benchgrid.logger.model;

import benchgrid.events.EventKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One ingested lifecycle event. Immutable; the instance id is filled in by
 * the timeline when the event is correlated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LifecycleEvent(
        @JsonProperty("node") String node,
        @JsonProperty("event") EventKind kind,
        @JsonProperty("time") double time,
        @JsonProperty("task_name") String taskName,
        @JsonProperty("task_instance") String taskInstance) {

    public LifecycleEvent {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static LifecycleEvent of(String node, EventKind kind, double time, String taskName) {
        return new LifecycleEvent(node, kind, time, taskName, null);
    }

    public LifecycleEvent withInstance(String instanceId) {
        return new LifecycleEvent(node, kind, time, taskName, instanceId);
    }
}
