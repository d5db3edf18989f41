package benchgrid.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one unit of benchmark work: a task type plus its
 * numeric parameter bag. Created when the task set is seeded, never mutated.
 */
public final class TaskSpec {
    private final TaskType type;
    private final Map<String, Number> parameters;

    private TaskSpec(TaskType type, Map<String, Number> parameters) {
        this.type = Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(parameters, "parameters are required");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static TaskSpec of(TaskType type, Map<String, Number> parameters) {
        return new TaskSpec(type, parameters);
    }

    /** Task spec carrying the type's default parameters */
    public static TaskSpec withDefaults(TaskType type) {
        return new TaskSpec(type, type.defaultParameters());
    }

    public TaskType type() {
        return type;
    }

    public Map<String, Number> parameters() {
        return parameters;
    }

    /** Value-based equality: two seeded tasks of the same type and parameters are interchangeable. */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskSpec spec))
            return false;
        return type == spec.type && parameters.equals(spec.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, parameters);
    }

    @Override
    public String toString() {
        return "TaskSpec{type=" + type + ", parameters=" + parameters + "}";
    }
}
