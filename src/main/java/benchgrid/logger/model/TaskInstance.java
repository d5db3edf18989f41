package benchgrid.logger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One concrete execution of a task type, from assignment to completion.
 * Finishing returns a new instance and leaves this one unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskInstance(
        @JsonProperty("instance_id") String instanceId,
        @JsonProperty("task_name") String taskType,
        @JsonProperty("node") String node,
        @JsonProperty("assigned_time") double assignedTime,
        @JsonProperty("finished_time") Double finishedTime,
        @JsonProperty("duration") Double duration,
        @JsonProperty("events") List<LifecycleEvent> events) {

    public TaskInstance {
        events = List.copyOf(events);
    }

    public static TaskInstance assigned(String instanceId, LifecycleEvent event) {
        return new TaskInstance(instanceId, event.taskName(), event.node(), event.time(), null, null,
                List.of(event));
    }

    /**
     * Close this instance with a finish event; duration is finish minus assignment.
     */
    public TaskInstance finish(LifecycleEvent event) {
        List<LifecycleEvent> all = new ArrayList<>(events);
        all.add(event);
        return new TaskInstance(instanceId, taskType, node, assignedTime, event.time(),
                event.time() - assignedTime, all);
    }

    @JsonIgnore
    public boolean isFinished() {
        return finishedTime != null;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return duration != null;
    }
}
