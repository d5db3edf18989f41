package benchgrid.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Builds the task set a scheduler is seeded with.
 */
public final class TaskSets {

    /** 3 x array, 2 x fileIO, 3 x matmul, 5 x primes */
    public static final String DEFAULT_SET = "array:3,fileIO:2,matmul:3,primes:5";

    private TaskSets() {
    }

    public static List<TaskSpec> defaultSet() {
        return parse(DEFAULT_SET, Map.of());
    }

    /**
     * Parse a {@code type:count,type:count} list. A bare type counts once.
     *
     * @param overrides parameter overrides keyed {@code type.param}, e.g. {@code matmul.size}
     */
    public static List<TaskSpec> parse(String taskSet, Map<String, Number> overrides) {
        if (taskSet == null || taskSet.isBlank()) {
            throw new IllegalArgumentException("task set must not be empty");
        }
        List<TaskSpec> tasks = new ArrayList<>();
        for (String entry : taskSet.split(",")) {
            String item = entry.trim();
            if (item.isEmpty()) {
                continue;
            }
            String[] parts = item.split(":", 2);
            TaskType type = TaskType.fromWireName(parts[0])
                    .orElseThrow(() -> new IllegalArgumentException("unknown task type '" + parts[0].trim() + "'"));
            int count = 1;
            if (parts.length == 2) {
                try {
                    count = Integer.parseInt(parts[1].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("bad count in '" + item + "'");
                }
                if (count < 0) {
                    throw new IllegalArgumentException("negative count in '" + item + "'");
                }
            }
            TaskSpec task = TaskSpec.of(type, parametersFor(type, overrides));
            for (int i = 0; i < count; i++) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    /**
     * Shuffled copy; a null seed uses a fresh random source.
     */
    public static List<TaskSpec> shuffled(List<TaskSpec> tasks, Long seed) {
        List<TaskSpec> copy = new ArrayList<>(tasks);
        Collections.shuffle(copy, seed == null ? new Random() : new Random(seed));
        return copy;
    }

    private static Map<String, Number> parametersFor(TaskType type, Map<String, Number> overrides) {
        Map<String, Number> params = new LinkedHashMap<>(type.defaultParameters());
        String prefix = type.wireName() + ".";
        overrides.forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                params.put(key.substring(prefix.length()), value);
            }
        });
        return params;
    }
}
